package crewdesk.workflow.store;

import crewdesk.workflow.model.SystemEvent;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.repository.SystemEventRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static crewdesk.workflow.store.JdbcSupport.getInstant;
import static crewdesk.workflow.store.JdbcSupport.getLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.setLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of SystemEventRepository.
 */
public class JdbcSystemEventRepository implements SystemEventRepository {

    private final Database db;

    public JdbcSystemEventRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(SystemEvent event) {
        String sql = """
                    INSERT INTO system_events (tenant_id, source, event_type, message, job_id, cleaner_id, phone,
                                               metadata, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.tenantId());
            ps.setString(2, event.source());
            ps.setString(3, event.type().name());
            ps.setString(4, event.message());
            setLongOrNull(ps, 5, event.jobId());
            setLongOrNull(ps, 6, event.cleanerId());
            ps.setString(7, event.phone());
            ps.setString(8, event.metadata());
            setTimestamp(ps, 9, event.createdAt() != null ? event.createdAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append event: " + event.type(), e);
        }
    }

    @Override
    public List<SystemEvent> findByJobId(long jobId) {
        String sql = "SELECT * FROM system_events WHERE job_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find events for job: " + jobId, e);
        }
    }

    @Override
    public List<SystemEvent> findRecent(int limit) {
        String sql = "SELECT * FROM system_events ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent events", e);
        }
    }

    private List<SystemEvent> executeQuery(PreparedStatement ps) throws SQLException {
        List<SystemEvent> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new SystemEvent(
                        rs.getLong("id"),
                        rs.getString("tenant_id"),
                        rs.getString("source"),
                        SystemEventType.valueOf(rs.getString("event_type")),
                        rs.getString("message"),
                        getLongOrNull(rs, "job_id"),
                        getLongOrNull(rs, "cleaner_id"),
                        rs.getString("phone"),
                        rs.getString("metadata"),
                        getInstant(rs, "created_at")));
            }
        }
        return results;
    }
}
