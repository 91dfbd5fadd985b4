package quarry.engine.store;

import quarry.engine.model.JobLogEntry;
import quarry.engine.repository.JobLogStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JDBC implementation of JobLogStore.
 */
public class JdbcJobLogStore implements JobLogStore {

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final Database db;

    public JdbcJobLogStore(Database db) {
        this.db = db;
    }

    @Override
    public void append(String jobId, JobLogEntry.Level level, String message) {
        String sql = "INSERT INTO job_logs (job_id, log_level, message, created_at) VALUES (?, ?, ?, ?)";

        String text = message == null ? "" : message;
        if (text.length() > MAX_MESSAGE_LENGTH) {
            text = text.substring(0, MAX_MESSAGE_LENGTH);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, level.name());
            ps.setString(3, text);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append log for job: " + jobId, e);
        }
    }

    @Override
    public List<JobLogEntry> findByJob(String jobId, int limit) {
        String sql = "SELECT * FROM job_logs WHERE job_id = ? ORDER BY created_at, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read logs for job: " + jobId, e);
        }
    }

    @Override
    public List<JobLogEntry> findByJobs(Collection<String> jobIds, int limit) {
        if (jobIds.isEmpty()) {
            return List.of();
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM job_logs WHERE job_id IN (");
        for (int i = 0; i < jobIds.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        sql.append(") ORDER BY created_at, id LIMIT ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int index = 1;
            for (String id : jobIds) {
                ps.setString(index++, id);
            }
            ps.setInt(index, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read aggregated logs", e);
        }
    }

    private List<JobLogEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobLogEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(new JobLogEntry(
                        rs.getLong("id"),
                        rs.getString("job_id"),
                        JobLogEntry.Level.valueOf(rs.getString("log_level")),
                        rs.getString("message"),
                        rs.getTimestamp("created_at").toInstant()));
            }
        }
        return entries;
    }
}
