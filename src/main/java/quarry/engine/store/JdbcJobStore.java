package quarry.engine.store;

import quarry.engine.model.Job;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobPage;
import quarry.engine.model.JobProgress;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobState;
import quarry.engine.model.JobStatus;
import quarry.engine.model.ProgressDelta;
import quarry.engine.repository.JobStore;
import quarry.engine.util.Errors;
import quarry.engine.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of JobStore.
 * Jobs and their states live in two tables written in one transaction.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String SELECT_SNAPSHOT = "SELECT j.*, s.* FROM jobs j JOIN job_states s ON s.job_id = j.id";

    private final Database db;

    public JdbcJobStore(Database db) {
        this.db = db;
    }

    @Override
    public boolean create(Job job) {
        String insertJob = """
                    INSERT INTO jobs (id, parent_id, manager_id, type, name, config, depth, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String insertState = """
                    INSERT INTO job_states (job_id, status, last_heartbeat)
                    VALUES (?, 'PENDING', ?)
                """;

        try (Connection conn = db.getConnection()) {
            Timestamp now = Timestamp.from(Instant.now());
            try {
                try (PreparedStatement ps = conn.prepareStatement(insertJob)) {
                    ps.setString(1, job.id());
                    ps.setString(2, job.parentId());
                    ps.setString(3, job.managerId());
                    ps.setString(4, job.type());
                    ps.setString(5, job.name());
                    ps.setString(6, Json.write(job.config()));
                    ps.setInt(7, job.depth());
                    ps.setTimestamp(8, job.createdAt() != null ? Timestamp.from(job.createdAt()) : now);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(insertState)) {
                    ps.setString(1, job.id());
                    ps.setTimestamp(2, now);
                    ps.executeUpdate();
                }

                // Parent must exist; counters move with the child in the same transaction
                if (job.parentId() != null) {
                    if (applyDelta(conn, job.parentId(), ProgressDelta.childCreated(), now) == 0) {
                        conn.rollback();
                        throw new IllegalArgumentException("Parent job not found: " + job.parentId());
                    }
                    if (job.managerId() != null && !job.managerId().equals(job.parentId())) {
                        applyDelta(conn, job.managerId(), ProgressDelta.childCreated(), now);
                    }
                }

                conn.commit();
                log.debug("Created job {} ({}) under {}", job.id(), job.type(), job.parentId());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (Database.isDuplicateKey(e)) {
                    log.debug("Job {} already exists, skipping create", job.id());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create job: " + job.id(), e);
        }
    }

    @Override
    public Optional<JobSnapshot> find(String jobId) {
        String sql = SELECT_SNAPSHOT + " WHERE j.id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public JobPage list(JobFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (filter.rootsOnly()) {
            where.append(" AND j.parent_id IS NULL");
        } else if (filter.parentId() != null) {
            where.append(" AND j.parent_id = ?");
            params.add(filter.parentId());
        }
        if (filter.managerId() != null) {
            where.append(" AND j.manager_id = ?");
            params.add(filter.managerId());
        }
        if (!filter.statuses().isEmpty()) {
            where.append(" AND s.status IN (");
            int i = 0;
            for (JobStatus status : filter.statuses()) {
                where.append(i++ == 0 ? "?" : ", ?");
                params.add(status.name());
            }
            where.append(")");
        }
        if (filter.type() != null) {
            where.append(" AND j.type = ?");
            params.add(filter.type());
        }
        if (filter.createdAfter() != null) {
            where.append(" AND j.created_at >= ?");
            params.add(filter.createdAfter());
        }
        if (filter.createdBefore() != null) {
            where.append(" AND j.created_at < ?");
            params.add(filter.createdBefore());
        }

        String countSql = "SELECT COUNT(*) FROM jobs j JOIN job_states s ON s.job_id = j.id" + where;
        String pageSql = SELECT_SNAPSHOT + where + " ORDER BY j.created_at DESC, j.id DESC LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection()) {
            int total;
            try (PreparedStatement ps = conn.prepareStatement(countSql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    total = rs.getInt(1);
                }
            }

            List<JobSnapshot> items;
            try (PreparedStatement ps = conn.prepareStatement(pageSql)) {
                int next = bind(ps, params);
                ps.setInt(next, filter.limit());
                ps.setInt(next + 1, filter.offset());
                items = executeQuery(ps);
            }
            return new JobPage(items, total, filter.limit(), filter.offset());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs", e);
        }
    }

    @Override
    public List<JobSnapshot> listChildren(String parentId) {
        String sql = SELECT_SNAPSHOT + " WHERE j.parent_id = ? ORDER BY j.created_at, j.id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, parentId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list children of job: " + parentId, e);
        }
    }

    @Override
    public List<String> listDescendantIds(String jobId) {
        try (Connection conn = db.getConnection()) {
            return descendants(conn, jobId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list descendants of job: " + jobId, e);
        }
    }

    @Override
    public Map<JobStatus, Integer> countByStatusUnder(String managerId) {
        String sql = """
                    SELECT s.status, COUNT(*) AS cnt
                    FROM jobs j JOIN job_states s ON s.job_id = j.id
                    WHERE j.manager_id = ?
                    GROUP BY s.status
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, managerId);
            Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs under: " + managerId, e);
        }
    }

    @Override
    public boolean transition(String jobId, JobStatus from, JobStatus to, String error) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal transition " + from + " -> " + to + " for job " + jobId);
        }

        try (Connection conn = db.getConnection()) {
            Timestamp now = Timestamp.from(Instant.now());

            // 1. CAS on the job's own status (WHERE guarantees a single winner)
            int updated;
            if (to == JobStatus.RUNNING) {
                String sql = """
                            UPDATE job_states SET status = ?, started_at = COALESCE(started_at, ?), last_heartbeat = ?
                            WHERE job_id = ? AND status = ?
                        """;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, to.name());
                    ps.setTimestamp(2, now);
                    ps.setTimestamp(3, now);
                    ps.setString(4, jobId);
                    ps.setString(5, from.name());
                    updated = ps.executeUpdate();
                }
            } else {
                String sql = """
                            UPDATE job_states SET status = ?, completed_at = ?, last_heartbeat = ?, error = COALESCE(?, error)
                            WHERE job_id = ? AND status = ?
                        """;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, to.name());
                    ps.setTimestamp(2, now);
                    ps.setTimestamp(3, now);
                    ps.setString(4, error != null ? Errors.truncate(error) : null);
                    ps.setString(5, jobId);
                    ps.setString(6, from.name());
                    updated = ps.executeUpdate();
                }
            }

            if (updated == 0) {
                conn.rollback();
                return false;
            }

            // 2. Real transition: move the ancestors' counters in the same transaction
            String parentId = null;
            String managerId = null;
            try (PreparedStatement ps = conn.prepareStatement("SELECT parent_id, manager_id FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        parentId = rs.getString("parent_id");
                        managerId = rs.getString("manager_id");
                    }
                }
            }

            ProgressDelta delta = ProgressDelta.transition(from, to);
            if (parentId != null) {
                applyDelta(conn, parentId, delta, now);
                if (managerId != null && !managerId.equals(parentId)) {
                    applyDelta(conn, managerId, delta, null);
                }
            }

            conn.commit();
            log.debug("Job {} {} -> {}", jobId, from, to);
            return true;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to transition job: " + jobId, e);
        }
    }

    @Override
    public void incrementProgress(String jobId, ProgressDelta delta) {
        if (delta.isZero()) {
            return;
        }
        try (Connection conn = db.getConnection()) {
            applyDelta(conn, jobId, delta, null);
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to increment progress: " + jobId, e);
        }
    }

    @Override
    public void touchHeartbeat(String jobId) {
        String sql = "UPDATE job_states SET last_heartbeat = ? WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to touch heartbeat: " + jobId, e);
        }
    }

    @Override
    public void recordResult(String jobId, String resultJson, int resultCount) {
        String sql = "UPDATE job_states SET result = ?, result_count = ? WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resultJson);
            ps.setInt(2, resultCount);
            ps.setString(3, jobId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record result: " + jobId, e);
        }
    }

    @Override
    public void markPossiblyIncomplete(String jobId) {
        String sql = "UPDATE job_states SET incomplete = TRUE WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to flag job: " + jobId, e);
        }
    }

    @Override
    public int deleteTree(String jobId) {
        try (Connection conn = db.getConnection()) {
            List<String> ids = new ArrayList<>();
            ids.add(jobId);
            ids.addAll(descendants(conn, jobId));

            // Children first, root last
            int deleted = 0;
            try (PreparedStatement logs = conn.prepareStatement("DELETE FROM job_logs WHERE job_id = ?");
                    PreparedStatement seen = conn.prepareStatement("DELETE FROM crawl_seen WHERE scope_id = ?");
                    PreparedStatement states = conn.prepareStatement("DELETE FROM job_states WHERE job_id = ?");
                    PreparedStatement jobs = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                for (int i = ids.size() - 1; i >= 0; i--) {
                    String id = ids.get(i);
                    logs.setString(1, id);
                    logs.executeUpdate();
                    seen.setString(1, id);
                    seen.executeUpdate();
                    states.setString(1, id);
                    states.executeUpdate();
                    jobs.setString(1, id);
                    deleted += jobs.executeUpdate();
                }
            }

            conn.commit();
            log.debug("Deleted {} jobs under {}", deleted, jobId);
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public List<String> findExpiredRoots(Instant cutoff, int limit) {
        String sql = """
                    SELECT j.id FROM jobs j JOIN job_states s ON s.job_id = j.id
                    WHERE j.parent_id IS NULL
                      AND s.status IN ('COMPLETED', 'FAILED', 'CANCELLED')
                      AND s.completed_at < ?
                    ORDER BY s.completed_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            ps.setInt(2, limit);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find expired jobs", e);
        }
    }

    // --- Helpers ---

    /**
     * Single atomic increment of all counters; optionally touches the heartbeat.
     *
     * @return rows updated (0 if the job does not exist)
     */
    private int applyDelta(Connection conn, String jobId, ProgressDelta d, Timestamp heartbeat) throws SQLException {
        String sql = """
                    UPDATE job_states SET
                        p_total = p_total + ?,
                        p_pending = p_pending + ?,
                        p_running = p_running + ?,
                        p_completed = p_completed + ?,
                        p_failed = p_failed + ?,
                        p_cancelled = p_cancelled + ?,
                        last_heartbeat = COALESCE(?, last_heartbeat)
                    WHERE job_id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, d.total());
            ps.setInt(2, d.pending());
            ps.setInt(3, d.running());
            ps.setInt(4, d.completed());
            ps.setInt(5, d.failed());
            ps.setInt(6, d.cancelled());
            ps.setTimestamp(7, heartbeat);
            ps.setString(8, jobId);
            return ps.executeUpdate();
        }
    }

    private List<String> descendants(Connection conn, String jobId) throws SQLException {
        List<String> result = new ArrayList<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(jobId);
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM jobs WHERE parent_id = ? ORDER BY created_at")) {
            while (!frontier.isEmpty()) {
                ps.setString(1, frontier.poll());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String id = rs.getString("id");
                        result.add(id);
                        frontier.add(id);
                    }
                }
            }
        }
        return result;
    }

    private int bind(PreparedStatement ps, List<Object> params) throws SQLException {
        int index = 1;
        for (Object param : params) {
            if (param instanceof Instant instant) {
                ps.setTimestamp(index++, Timestamp.from(instant));
            } else {
                ps.setString(index++, (String) param);
            }
        }
        return index;
    }

    private List<JobSnapshot> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobSnapshot> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private JobSnapshot mapRow(ResultSet rs) throws SQLException {
        Job job = Job.builder()
                .id(rs.getString("id"))
                .parentId(rs.getString("parent_id"))
                .managerId(rs.getString("manager_id"))
                .type(rs.getString("type"))
                .name(rs.getString("name"))
                .config(Json.readMap(rs.getString("config")))
                .depth(rs.getInt("depth"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();

        JobState state = JobState.builder()
                .jobId(job.id())
                .status(JobStatus.valueOf(rs.getString("status")))
                .progress(new JobProgress(
                        rs.getInt("p_total"),
                        rs.getInt("p_pending"),
                        rs.getInt("p_running"),
                        rs.getInt("p_completed"),
                        rs.getInt("p_failed"),
                        rs.getInt("p_cancelled")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .error(rs.getString("error"))
                .resultCount(rs.getInt("result_count"))
                .result(rs.getString("result"))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .possiblyIncomplete(rs.getBoolean("incomplete"))
                .build();

        return new JobSnapshot(job, state);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
