package quarry.engine.store;

import quarry.engine.repository.DedupStore;
import quarry.engine.util.JobIds;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * JDBC implementation of DedupStore, keyed by (scope, url hash).
 */
public class JdbcDedupStore implements DedupStore {

    private final Database db;

    public JdbcDedupStore(Database db) {
        this.db = db;
    }

    @Override
    public boolean markSeen(String scopeId, String url) {
        String sql = "INSERT INTO crawl_seen (scope_id, url_hash, url, seen_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, scopeId);
                ps.setString(2, JobIds.digest(url));
                ps.setString(3, url);
                ps.setTimestamp(4, Timestamp.from(Instant.now()));
                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (Database.isDuplicateKey(e)) {
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record crawl url for: " + scopeId, e);
        }
    }

    @Override
    public int countSeen(String scopeId) {
        String sql = "SELECT COUNT(*) FROM crawl_seen WHERE scope_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scopeId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count crawl urls for: " + scopeId, e);
        }
    }
}
