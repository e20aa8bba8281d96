package crewdesk.workflow.store;

import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.repository.CleanerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static crewdesk.workflow.store.JdbcSupport.getDoubleOrNull;
import static crewdesk.workflow.store.JdbcSupport.setDoubleOrNull;

/**
 * JDBC implementation of CleanerRepository.
 */
public class JdbcCleanerRepository implements CleanerRepository {

    private final Database db;

    public JdbcCleanerRepository(Database db) {
        this.db = db;
    }

    @Override
    public Cleaner insert(Cleaner cleaner) {
        String sql = """
                    INSERT INTO cleaners (tenant_id, name, phone, chat_id, active, team_lead, home_latitude, home_longitude)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, cleaner.tenantId());
            ps.setString(2, cleaner.name());
            ps.setString(3, cleaner.phone());
            ps.setString(4, cleaner.chatId());
            ps.setBoolean(5, cleaner.active());
            ps.setBoolean(6, cleaner.teamLead());
            setDoubleOrNull(ps, 7, cleaner.homeLatitude());
            setDoubleOrNull(ps, 8, cleaner.homeLongitude());

            ps.executeUpdate();
            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated id returned for cleaner");
                }
                id = keys.getLong(1);
            }
            conn.commit();

            return new Cleaner(id, cleaner.tenantId(), cleaner.name(), cleaner.phone(), cleaner.chatId(),
                    cleaner.active(), cleaner.teamLead(), cleaner.homeLatitude(), cleaner.homeLongitude());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert cleaner: " + cleaner.name(), e);
        }
    }

    @Override
    public Optional<Cleaner> findById(long cleanerId) {
        String sql = "SELECT * FROM cleaners WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, cleanerId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cleaner: " + cleanerId, e);
        }
    }

    @Override
    public List<Cleaner> findActive(String tenantId) {
        String sql = """
                    SELECT * FROM cleaners
                    WHERE active = TRUE AND (CAST(? AS VARCHAR) IS NULL OR tenant_id = ?)
                    ORDER BY team_lead DESC, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, tenantId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list active cleaners", e);
        }
    }

    private List<Cleaner> executeQuery(PreparedStatement ps) throws SQLException {
        List<Cleaner> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new Cleaner(
                        rs.getLong("id"),
                        rs.getString("tenant_id"),
                        rs.getString("name"),
                        rs.getString("phone"),
                        rs.getString("chat_id"),
                        rs.getBoolean("active"),
                        rs.getBoolean("team_lead"),
                        getDoubleOrNull(rs, "home_latitude"),
                        getDoubleOrNull(rs, "home_longitude")));
            }
        }
        return results;
    }
}
