package crewdesk.workflow.store;

import crewdesk.workflow.model.AssignmentStatus;
import crewdesk.workflow.model.CleanerAssignment;
import crewdesk.workflow.repository.AssignmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static crewdesk.workflow.store.JdbcSupport.getDoubleOrNull;
import static crewdesk.workflow.store.JdbcSupport.getInstant;
import static crewdesk.workflow.store.JdbcSupport.isUniqueViolation;
import static crewdesk.workflow.store.JdbcSupport.setDoubleOrNull;
import static crewdesk.workflow.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of AssignmentRepository.
 * The unique index on {@code active_job_id} keeps one live offer per job.
 */
public class JdbcAssignmentRepository implements AssignmentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAssignmentRepository.class);

    private final Database db;

    public JdbcAssignmentRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<CleanerAssignment> createPending(long jobId, long cleanerId, Double distanceMiles, Instant now) {
        String sql = """
                    INSERT INTO cleaner_assignments (job_id, cleaner_id, status, distance_miles, active_job_id, assigned_at)
                    VALUES (?, ?, 'PENDING', ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, jobId);
                ps.setLong(2, cleanerId);
                setDoubleOrNull(ps, 3, distanceMiles);
                ps.setLong(4, jobId);
                setTimestamp(ps, 5, now);

                ps.executeUpdate();
                long id;
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated id returned for assignment");
                    }
                    id = keys.getLong(1);
                }
                conn.commit();

                return Optional.of(new CleanerAssignment(id, jobId, cleanerId, AssignmentStatus.PENDING,
                        distanceMiles, now, null));
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    log.warn("Job {} already has a live assignment, not offering to cleaner {}", jobId, cleanerId);
                    return Optional.empty();
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create assignment for job: " + jobId, e);
        }
    }

    @Override
    public Optional<CleanerAssignment> findById(long assignmentId) {
        String sql = "SELECT * FROM cleaner_assignments WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, assignmentId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find assignment: " + assignmentId, e);
        }
    }

    @Override
    public List<CleanerAssignment> findByJobId(long jobId) {
        String sql = "SELECT * FROM cleaner_assignments WHERE job_id = ? ORDER BY assigned_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find assignments for job: " + jobId, e);
        }
    }

    @Override
    public Optional<CleanerAssignment> findLiveByJobId(long jobId) {
        String sql = "SELECT * FROM cleaner_assignments WHERE active_job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find live assignment for job: " + jobId, e);
        }
    }

    @Override
    public boolean confirm(long assignmentId, Instant now) {
        String sql = """
                    UPDATE cleaner_assignments
                    SET status = 'CONFIRMED', responded_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;
        return transition(sql, assignmentId, now);
    }

    @Override
    public boolean decline(long assignmentId, Instant now) {
        String sql = """
                    UPDATE cleaner_assignments
                    SET status = 'DECLINED', active_job_id = NULL, responded_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;
        return transition(sql, assignmentId, now);
    }

    @Override
    public boolean cancel(long assignmentId, Instant now) {
        String sql = """
                    UPDATE cleaner_assignments
                    SET status = 'CANCELLED', active_job_id = NULL, responded_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;
        return transition(sql, assignmentId, now);
    }

    private boolean transition(String sql, long assignmentId, Instant now) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setLong(2, assignmentId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update assignment: " + assignmentId, e);
        }
    }

    @Override
    public List<CleanerAssignment> findPendingAssignedBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM cleaner_assignments
                    WHERE status = 'PENDING' AND assigned_at < ?
                    ORDER BY assigned_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale offers", e);
        }
    }

    @Override
    public Set<Long> findContactedCleanerIds(long jobId) {
        String sql = "SELECT cleaner_id FROM cleaner_assignments WHERE job_id = ? ORDER BY assigned_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            Set<Long> ids = new LinkedHashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find contacted cleaners for job: " + jobId, e);
        }
    }

    private List<CleanerAssignment> executeQuery(PreparedStatement ps) throws SQLException {
        List<CleanerAssignment> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new CleanerAssignment(
                        rs.getLong("id"),
                        rs.getLong("job_id"),
                        rs.getLong("cleaner_id"),
                        AssignmentStatus.valueOf(rs.getString("status")),
                        getDoubleOrNull(rs, "distance_miles"),
                        getInstant(rs, "assigned_at"),
                        getInstant(rs, "responded_at")));
            }
        }
        return results;
    }
}
