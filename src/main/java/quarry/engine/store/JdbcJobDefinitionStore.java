package quarry.engine.store;

import quarry.engine.model.JobDefinition;
import quarry.engine.repository.JobDefinitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobDefinitionStore. The definition is stored as JSON.
 */
public class JdbcJobDefinitionStore implements JobDefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobDefinitionStore.class);

    private final Database db;

    public JdbcJobDefinitionStore(Database db) {
        this.db = db;
    }

    @Override
    public void save(JobDefinition definition) {
        String update = "UPDATE job_definitions SET name = ?, type = ?, enabled = ?, body = ?, updated_at = ? WHERE id = ?";
        String insert = "INSERT INTO job_definitions (name, type, enabled, body, updated_at, id) VALUES (?, ?, ?, ?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                bind(ps, definition);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(insert)) {
                    bind(ps, definition);
                    ps.executeUpdate();
                }
            }
            conn.commit();
            log.debug("Saved job definition {}", definition.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job definition: " + definition.id(), e);
        }
    }

    @Override
    public Optional<JobDefinition> findById(String id) {
        String sql = "SELECT body FROM job_definitions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(JobDefinition.fromJson(rs.getString("body")));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job definition: " + id, e);
        }
    }

    @Override
    public List<JobDefinition> findAll() {
        String sql = "SELECT body FROM job_definitions ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<JobDefinition> definitions = new ArrayList<>();
            while (rs.next()) {
                definitions.add(JobDefinition.fromJson(rs.getString("body")));
            }
            return definitions;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list job definitions", e);
        }
    }

    @Override
    public boolean delete(String id) {
        String sql = "DELETE FROM job_definitions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job definition: " + id, e);
        }
    }

    private void bind(PreparedStatement ps, JobDefinition definition) throws SQLException {
        ps.setString(1, definition.name());
        ps.setString(2, definition.type());
        ps.setBoolean(3, definition.enabledFlag());
        ps.setString(4, definition.toJson());
        ps.setTimestamp(5, Timestamp.from(Instant.now()));
        ps.setString(6, definition.id());
    }
}
