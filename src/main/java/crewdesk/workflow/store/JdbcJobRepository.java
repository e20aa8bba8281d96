package crewdesk.workflow.store;

import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static crewdesk.workflow.store.JdbcSupport.getDate;
import static crewdesk.workflow.store.JdbcSupport.getDoubleOrNull;
import static crewdesk.workflow.store.JdbcSupport.getInstant;
import static crewdesk.workflow.store.JdbcSupport.getLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.getTime;
import static crewdesk.workflow.store.JdbcSupport.setDate;
import static crewdesk.workflow.store.JdbcSupport.setDoubleOrNull;
import static crewdesk.workflow.store.JdbcSupport.setLongOrNull;
import static crewdesk.workflow.store.JdbcSupport.setTime;
import static crewdesk.workflow.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public Job insert(Job job) {
        String sql = """
                    INSERT INTO jobs (tenant_id, customer_name, customer_phone, address, service_date, scheduled_time,
                                      price, status, cleaner_id, latitude, longitude, cleaner_confirmed,
                                      customer_notified, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, job.tenantId());
            ps.setString(2, job.customerName());
            ps.setString(3, job.customerPhone());
            ps.setString(4, job.address());
            setDate(ps, 5, job.serviceDate());
            setTime(ps, 6, job.scheduledTime());
            setDoubleOrNull(ps, 7, job.price());
            ps.setString(8, job.status().name());
            setLongOrNull(ps, 9, job.cleanerId());
            setDoubleOrNull(ps, 10, job.latitude());
            setDoubleOrNull(ps, 11, job.longitude());
            ps.setBoolean(12, job.cleanerConfirmed());
            ps.setBoolean(13, job.customerNotified());
            setTimestamp(ps, 14, createdAt);
            setTimestamp(ps, 15, createdAt);

            ps.executeUpdate();
            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated id returned for job");
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Inserted job {} on {}", id, job.serviceDate());
            return job.toBuilder().id(id).createdAt(createdAt).updatedAt(createdAt).build();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert job for " + job.customerName(), e);
        }
    }

    @Override
    public Optional<Job> findById(long jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findActiveOnDate(LocalDate date, String tenantId) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE service_date = ? AND status <> 'CANCELLED'
                      AND (CAST(? AS VARCHAR) IS NULL OR tenant_id = ?)
                    ORDER BY scheduled_time NULLS LAST, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setDate(ps, 1, date);
            ps.setString(2, tenantId);
            ps.setString(3, tenantId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs on " + date, e);
        }
    }

    @Override
    public int countActiveOnDate(LocalDate date, String tenantId) {
        String sql = """
                    SELECT COUNT(*) FROM jobs
                    WHERE service_date = ? AND status <> 'CANCELLED'
                      AND (CAST(? AS VARCHAR) IS NULL OR tenant_id = ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setDate(ps, 1, date);
            ps.setString(2, tenantId);
            ps.setString(3, tenantId);

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs on " + date, e);
        }
    }

    @Override
    public Set<Long> findConfirmedCleanerIdsOnDate(LocalDate date) {
        String sql = """
                    SELECT DISTINCT cleaner_id FROM jobs
                    WHERE service_date = ? AND status <> 'CANCELLED'
                      AND cleaner_confirmed = TRUE AND cleaner_id IS NOT NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setDate(ps, 1, date);
            Set<Long> ids = new HashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find busy crew on " + date, e);
        }
    }

    @Override
    public boolean updateServiceDate(long jobId, LocalDate newDate, Instant now) {
        String sql = "UPDATE jobs SET service_date = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setDate(ps, 1, newDate);
            setTimestamp(ps, 2, now);
            ps.setLong(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move job " + jobId + " to " + newDate, e);
        }
    }

    @Override
    public boolean markCleanerConfirmed(long jobId, long cleanerId, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET cleaner_id = ?, cleaner_confirmed = TRUE, updated_at = ?,
                        status = CASE WHEN status = 'PENDING' THEN 'SCHEDULED' ELSE status END
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, cleanerId);
            setTimestamp(ps, 2, now);
            ps.setLong(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to confirm crew on job: " + jobId, e);
        }
    }

    @Override
    public boolean markCustomerNotified(long jobId, Instant now) {
        String sql = "UPDATE jobs SET customer_notified = TRUE, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setLong(2, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark customer notified for job: " + jobId, e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getLong("id"))
                .tenantId(rs.getString("tenant_id"))
                .customerName(rs.getString("customer_name"))
                .customerPhone(rs.getString("customer_phone"))
                .address(rs.getString("address"))
                .serviceDate(getDate(rs, "service_date"))
                .scheduledTime(getTime(rs, "scheduled_time"))
                .price(getDoubleOrNull(rs, "price"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .cleanerId(getLongOrNull(rs, "cleaner_id"))
                .latitude(getDoubleOrNull(rs, "latitude"))
                .longitude(getDoubleOrNull(rs, "longitude"))
                .cleanerConfirmed(rs.getBoolean("cleaner_confirmed"))
                .customerNotified(rs.getBoolean("customer_notified"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
