package quarry.engine.queue;

import quarry.engine.config.EngineConfig;
import quarry.engine.store.Database;
import quarry.engine.util.Errors;
import quarry.engine.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * MessageQueue on a database table. Leasing is a compare-and-swap on a
 * per-row version, so concurrent receivers never share a message.
 */
public class JdbcMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcMessageQueue.class);

    private static final int RECEIVE_CANDIDATES = 8;
    private static final int DELETE_ATTEMPTS = 3;
    private static final long DELETE_BACKOFF_MS = 200;

    private final Database db;
    private final Duration leaseDuration;

    public JdbcMessageQueue(Database db, EngineConfig config) {
        this(db, config.leaseDuration());
    }

    public JdbcMessageQueue(Database db, Duration leaseDuration) {
        this.db = db;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public boolean enqueueWithDelay(QueueMessage message, Duration delay) {
        String sql = """
                    INSERT INTO queue_messages (id, type, job_id, body, visible_at, receive_count, version, created_at)
                    VALUES (?, ?, ?, ?, ?, 0, 0, ?)
                """;

        try (Connection conn = db.getConnection()) {
            Instant now = Instant.now();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, message.id());
                ps.setString(2, message.type());
                ps.setString(3, message.jobId());
                ps.setString(4, Json.write(message.payload()));
                ps.setTimestamp(5, Timestamp.from(now.plus(delay)));
                ps.setTimestamp(6, Timestamp.from(now));
                ps.executeUpdate();
                conn.commit();
                log.debug("Enqueued {} ({}) delay={}ms", message.id(), message.type(), delay.toMillis());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isDuplicateKey(e)) {
                    log.debug("Message {} already queued", message.id());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue message: " + message.id(), e);
        }
    }

    @Override
    public void enqueueOrRearm(QueueMessage message, Duration delay) {
        String rearm = """
                    UPDATE queue_messages
                    SET body = ?, visible_at = ?, lease_token = NULL, receive_count = 0, version = version + 1
                    WHERE id = ?
                """;

        // Two rounds cover a concurrent delete between the update and the insert
        for (int round = 0; round < 2; round++) {
            try (Connection conn = db.getConnection();
                    PreparedStatement ps = conn.prepareStatement(rearm)) {
                ps.setString(1, Json.write(message.payload()));
                ps.setTimestamp(2, Timestamp.from(Instant.now().plus(delay)));
                ps.setString(3, message.id());
                int updated = ps.executeUpdate();
                conn.commit();
                if (updated > 0) {
                    log.debug("Rearmed {} delay={}ms", message.id(), delay.toMillis());
                    return;
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to rearm message: " + message.id(), e);
            }
            if (enqueueWithDelay(message, delay)) {
                return;
            }
        }
        throw new IllegalStateException("Could not enqueue or rearm message: " + message.id());
    }

    @Override
    public Optional<Lease> receive() {
        String candidates = """
                    SELECT id, version FROM queue_messages
                    WHERE visible_at <= ?
                    ORDER BY visible_at, created_at
                    LIMIT ?
                """;
        String claim = """
                    UPDATE queue_messages
                    SET lease_token = ?, visible_at = ?, receive_count = receive_count + 1, version = version + 1
                    WHERE id = ? AND version = ? AND visible_at <= ?
                """;

        try (Connection conn = db.getConnection()) {
            Timestamp now = Timestamp.from(Instant.now());

            // 1. Read a few visible candidates without locking
            List<String[]> rows = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(candidates)) {
                ps.setTimestamp(1, now);
                ps.setInt(2, RECEIVE_CANDIDATES);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new String[] { rs.getString("id"), Long.toString(rs.getLong("version")) });
                    }
                }
            }
            conn.commit();

            // 2. CAS on the row version; the first receiver to update wins
            for (String[] row : rows) {
                String token = UUID.randomUUID().toString();
                Instant expiresAt = Instant.now().plus(leaseDuration);
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(claim)) {
                    ps.setString(1, token);
                    ps.setTimestamp(2, Timestamp.from(expiresAt));
                    ps.setString(3, row[0]);
                    ps.setLong(4, Long.parseLong(row[1]));
                    ps.setTimestamp(5, now);
                    updated = ps.executeUpdate();
                } catch (SQLException e) {
                    // Lock conflict with a concurrent receiver: it owns the row now
                    conn.rollback();
                    log.debug("Lost race for message {}: {}", row[0], e.getMessage());
                    continue;
                }
                if (updated == 0) {
                    conn.rollback();
                    continue;
                }

                Optional<Lease> lease = readLease(conn, row[0], token, expiresAt);
                conn.commit();
                if (lease.isPresent()) {
                    return lease;
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to receive message", e);
        }
    }

    @Override
    public boolean delete(Lease lease) {
        String sql = "DELETE FROM queue_messages WHERE id = ? AND lease_token = ?";

        long backoff = DELETE_BACKOFF_MS;
        for (int attempt = 1;; attempt++) {
            try (Connection conn = db.getConnection();
                    PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, lease.messageId());
                ps.setString(2, lease.token());
                int deleted = ps.executeUpdate();
                conn.commit();
                if (deleted == 0) {
                    log.debug("Delete of {} skipped: lease no longer valid", lease.messageId());
                }
                return deleted > 0;
            } catch (SQLException e) {
                if (attempt >= DELETE_ATTEMPTS) {
                    throw new RuntimeException("Failed to delete message: " + lease.messageId(), e);
                }
                log.warn("Delete of {} failed (attempt {}/{}), retrying in {}ms: {}",
                        lease.messageId(), attempt, DELETE_ATTEMPTS, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while deleting message: " + lease.messageId(), e);
                }
                backoff *= 2;
            }
        }
    }

    @Override
    public boolean extend(Lease lease, Duration duration) {
        String sql = "UPDATE queue_messages SET visible_at = ? WHERE id = ? AND lease_token = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now().plus(duration)));
            ps.setString(2, lease.messageId());
            ps.setString(3, lease.token());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to extend lease: " + lease.messageId(), e);
        }
    }

    @Override
    public boolean release(Lease lease, Duration delay) {
        String sql = """
                    UPDATE queue_messages SET visible_at = ?, lease_token = NULL, version = version + 1
                    WHERE id = ? AND lease_token = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now().plus(delay)));
            ps.setString(2, lease.messageId());
            ps.setString(3, lease.token());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release message: " + lease.messageId(), e);
        }
    }

    @Override
    public boolean requeue(Lease lease, Duration delay, Map<String, Object> payload) {
        String sql = """
                    UPDATE queue_messages
                    SET body = ?, visible_at = ?, lease_token = NULL, receive_count = 0, version = version + 1
                    WHERE id = ? AND lease_token = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, Json.write(payload));
            ps.setTimestamp(2, Timestamp.from(Instant.now().plus(delay)));
            ps.setString(3, lease.messageId());
            ps.setString(4, lease.token());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue message: " + lease.messageId(), e);
        }
    }

    @Override
    public boolean deadLetter(Lease lease, String reason) {
        String copy = """
                    INSERT INTO dead_letters (id, type, job_id, body, receive_count, reason, created_at, dead_at)
                    SELECT id, type, job_id, body, receive_count, ?, created_at, ?
                    FROM queue_messages WHERE id = ? AND lease_token = ?
                """;

        try (Connection conn = db.getConnection()) {
            // A message id can be dead-lettered again after being re-enqueued
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM dead_letters WHERE id = ?")) {
                ps.setString(1, lease.messageId());
                ps.executeUpdate();
            }
            int copied;
            try (PreparedStatement ps = conn.prepareStatement(copy)) {
                ps.setString(1, Errors.truncate(reason));
                ps.setTimestamp(2, Timestamp.from(Instant.now()));
                ps.setString(3, lease.messageId());
                ps.setString(4, lease.token());
                copied = ps.executeUpdate();
            }
            if (copied == 0) {
                conn.rollback();
                return false;
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM queue_messages WHERE id = ? AND lease_token = ?")) {
                ps.setString(1, lease.messageId());
                ps.setString(2, lease.token());
                ps.executeUpdate();
            }
            conn.commit();
            log.warn("Dead-lettered message {} after {} deliveries: {}",
                    lease.messageId(), lease.receiveCount(), reason);
            return true;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to dead-letter message: " + lease.messageId(), e);
        }
    }

    @Override
    public Optional<QueueMessage> find(String messageId) {
        String sql = "SELECT id, type, job_id, body FROM queue_messages WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapMessage(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find message: " + messageId, e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM queue_messages");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count queue messages", e);
        }
    }

    @Override
    public List<DeadLetter> listDeadLetters(int limit) {
        String sql = "SELECT * FROM dead_letters ORDER BY dead_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<DeadLetter> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new DeadLetter(
                            mapMessage(rs),
                            rs.getInt("receive_count"),
                            rs.getString("reason"),
                            rs.getTimestamp("dead_at").toInstant()));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list dead letters", e);
        }
    }

    @Override
    public int purgeDeadLetters() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM dead_letters")) {
            int deleted = ps.executeUpdate();
            conn.commit();
            log.info("Purged {} dead letters", deleted);
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge dead letters", e);
        }
    }

    // --- Helpers ---

    private Optional<Lease> readLease(Connection conn, String id, String token, Instant expiresAt) throws SQLException {
        String sql = "SELECT id, type, job_id, body, receive_count FROM queue_messages WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Lease(mapMessage(rs), token, rs.getInt("receive_count"), expiresAt));
            }
        }
    }

    private QueueMessage mapMessage(ResultSet rs) throws SQLException {
        return new QueueMessage(
                rs.getString("id"),
                rs.getString("type"),
                rs.getString("job_id"),
                Json.readMap(rs.getString("body")));
    }

    private static boolean isDuplicateKey(SQLException e) {
        return "23505".equals(e.getSQLState());
    }
}
