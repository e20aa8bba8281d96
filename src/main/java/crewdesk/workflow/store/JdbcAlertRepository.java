package crewdesk.workflow.store;

import crewdesk.workflow.model.Alert;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.repository.AlertRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static crewdesk.workflow.store.JdbcSupport.getInstant;
import static crewdesk.workflow.store.JdbcSupport.getIntOrNull;
import static crewdesk.workflow.store.JdbcSupport.getLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.setIntOrNull;
import static crewdesk.workflow.store.JdbcSupport.setLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of AlertRepository.
 */
public class JdbcAlertRepository implements AlertRepository {

    private final Database db;

    public JdbcAlertRepository(Database db) {
        this.db = db;
    }

    @Override
    public Alert insert(Alert alert) {
        String sql = """
                    INSERT INTO alerts (job_id, alert_type, threshold_value, actual_value, message, acknowledged, created_at)
                    VALUES (?, ?, ?, ?, ?, FALSE, ?)
                """;

        Instant createdAt = alert.createdAt() != null ? alert.createdAt() : Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            setLongOrNull(ps, 1, alert.jobId());
            ps.setString(2, alert.type().name());
            setIntOrNull(ps, 3, alert.thresholdValue());
            setIntOrNull(ps, 4, alert.actualValue());
            ps.setString(5, alert.message());
            setTimestamp(ps, 6, createdAt);

            ps.executeUpdate();
            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated id returned for alert");
                }
                id = keys.getLong(1);
            }
            conn.commit();

            return new Alert(id, alert.jobId(), alert.type(), alert.thresholdValue(), alert.actualValue(),
                    alert.message(), false, createdAt);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert alert: " + alert.type(), e);
        }
    }

    @Override
    public Optional<Alert> findById(long alertId) {
        String sql = "SELECT * FROM alerts WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, alertId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find alert: " + alertId, e);
        }
    }

    @Override
    public List<Alert> findUnacknowledged(int limit) {
        String sql = "SELECT * FROM alerts WHERE acknowledged = FALSE ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list alerts", e);
        }
    }

    @Override
    public boolean existsUnacknowledged(AlertType type, long jobId) {
        String sql = "SELECT 1 FROM alerts WHERE alert_type = ? AND job_id = ? AND acknowledged = FALSE LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, type.name());
            ps.setLong(2, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up " + type + " alert for job: " + jobId, e);
        }
    }

    @Override
    public boolean acknowledge(long alertId) {
        String sql = "UPDATE alerts SET acknowledged = TRUE WHERE id = ? AND acknowledged = FALSE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, alertId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acknowledge alert: " + alertId, e);
        }
    }

    private List<Alert> executeQuery(PreparedStatement ps) throws SQLException {
        List<Alert> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new Alert(
                        rs.getLong("id"),
                        getLongOrNull(rs, "job_id"),
                        AlertType.valueOf(rs.getString("alert_type")),
                        getIntOrNull(rs, "threshold_value"),
                        getIntOrNull(rs, "actual_value"),
                        rs.getString("message"),
                        rs.getBoolean("acknowledged"),
                        getInstant(rs, "created_at")));
            }
        }
        return results;
    }
}
