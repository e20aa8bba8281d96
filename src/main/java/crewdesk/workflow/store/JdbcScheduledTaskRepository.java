package crewdesk.workflow.store;

import crewdesk.workflow.model.ScheduleResult;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskFailResult;
import crewdesk.workflow.model.TaskStatus;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.repository.ScheduledTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static crewdesk.workflow.store.JdbcSupport.getInstant;
import static crewdesk.workflow.store.JdbcSupport.isUniqueViolation;
import static crewdesk.workflow.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of ScheduledTaskRepository.
 * Claims are a single conditional UPDATE; dedup relies on the unique index
 * over {@code active_key}.
 */
public class JdbcScheduledTaskRepository implements ScheduledTaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduledTaskRepository.class);

    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final Database db;

    public JdbcScheduledTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public ScheduleResult insert(ScheduledTask task) {
        String sql = """
                    INSERT INTO scheduled_tasks (id, tenant_id, task_type, dedup_key, active_key, due_at, payload,
                                                 status, attempts, max_attempts, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, 'PENDING', 0, ?, ?, ?)
                """;

        // A collision can race with the holder finishing, so look again and retry a few times
        for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
            try (Connection conn = db.getConnection()) {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, task.id());
                    ps.setString(2, task.tenantId());
                    ps.setString(3, task.type().name());
                    ps.setString(4, task.dedupKey());
                    ps.setString(5, task.dedupKey());
                    setTimestamp(ps, 6, task.dueAt());
                    ps.setString(7, task.payload());
                    ps.setInt(8, task.maxAttempts());
                    setTimestamp(ps, 9, task.createdAt());
                    setTimestamp(ps, 10, task.createdAt());

                    ps.executeUpdate();
                    conn.commit();

                    log.debug("Inserted task {} ({}, key={})", task.id(), task.type(), task.dedupKey());
                    return ScheduleResult.created(task.id());
                } catch (SQLException e) {
                    conn.rollback();
                    if (task.dedupKey() == null || !isUniqueViolation(e)) {
                        throw e;
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to insert task: " + task.id(), e);
            }

            Optional<ScheduledTask> existing = findLiveByDedupKey(task.dedupKey());
            if (existing.isPresent()) {
                log.debug("Dedup key {} already held by task {}", task.dedupKey(), existing.get().id());
                return ScheduleResult.existing(existing.get().id());
            }
        }

        throw new RuntimeException("Failed to insert task " + task.id() + ": dedup key "
                + task.dedupKey() + " kept colliding");
    }

    @Override
    public Optional<ScheduledTask> findById(String taskId) {
        String sql = "SELECT * FROM scheduled_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Optional<ScheduledTask> findLiveByDedupKey(String dedupKey) {
        String sql = "SELECT * FROM scheduled_tasks WHERE active_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, dedupKey);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task by dedup key: " + dedupKey, e);
        }
    }

    @Override
    public List<ScheduledTask> findDue(Instant now, int limit) {
        String sql = """
                    SELECT * FROM scheduled_tasks
                    WHERE status = 'PENDING' AND due_at <= ?
                    ORDER BY due_at, created_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find due tasks", e);
        }
    }

    @Override
    public Optional<ScheduledTask> claim(String taskId, Instant now) {
        String updateSql = """
                    UPDATE scheduled_tasks
                    SET status = 'PROCESSING', attempts = attempts + 1, claimed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;
        String selectSql = "SELECT * FROM scheduled_tasks WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                    PreparedStatement select = conn.prepareStatement(selectSql)) {

                setTimestamp(update, 1, now);
                setTimestamp(update, 2, now);
                update.setString(3, taskId);

                if (update.executeUpdate() == 0) {
                    conn.rollback();
                    return Optional.empty();
                }

                select.setString(1, taskId);
                Optional<ScheduledTask> claimed = executeQuery(select).stream().findFirst();
                conn.commit();

                log.debug("Claimed task {}", taskId);
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim task: " + taskId, e);
        }
    }

    @Override
    public boolean complete(String taskId, Instant now) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'COMPLETED', active_key = NULL, executed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            setTimestamp(ps, 2, now);
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete task: " + taskId, e);
        }
    }

    @Override
    public TaskFailResult fail(String taskId, String error, Instant now, Instant retryDueAt) {
        String lockSql = "SELECT status, attempts, max_attempts FROM scheduled_tasks WHERE id = ? FOR UPDATE";
        String retrySql = """
                    UPDATE scheduled_tasks
                    SET status = 'PENDING', last_error = ?, claimed_at = NULL, updated_at = ?,
                        due_at = COALESCE(?, due_at)
                    WHERE id = ? AND status = 'PROCESSING'
                """;
        String failSql = """
                    UPDATE scheduled_tasks
                    SET status = 'FAILED', active_key = NULL, last_error = ?, executed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskStatus status;
                int attempts;
                int maxAttempts;
                try (PreparedStatement lock = conn.prepareStatement(lockSql)) {
                    lock.setString(1, taskId);
                    try (ResultSet rs = lock.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return TaskFailResult.NOT_FOUND;
                        }
                        status = TaskStatus.valueOf(rs.getString("status"));
                        attempts = rs.getInt("attempts");
                        maxAttempts = rs.getInt("max_attempts");
                    }
                }

                if (status != TaskStatus.PROCESSING) {
                    conn.rollback();
                    log.warn("Task {} is not PROCESSING (status: {}), ignoring failure", taskId, status);
                    return TaskFailResult.ALREADY_TERMINAL;
                }

                String truncated = truncate(error);
                if (attempts < maxAttempts) {
                    try (PreparedStatement ps = conn.prepareStatement(retrySql)) {
                        ps.setString(1, truncated);
                        setTimestamp(ps, 2, now);
                        setTimestamp(ps, 3, retryDueAt);
                        ps.setString(4, taskId);
                        ps.executeUpdate();
                    }
                    conn.commit();
                    log.debug("Task {} will retry (attempt {}/{})", taskId, attempts, maxAttempts);
                    return TaskFailResult.RETRIED;
                }

                try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                    ps.setString(1, truncated);
                    setTimestamp(ps, 2, now);
                    setTimestamp(ps, 3, now);
                    ps.setString(4, taskId);
                    ps.executeUpdate();
                }
                conn.commit();
                log.debug("Task {} permanently failed after {} attempts", taskId, attempts);
                return TaskFailResult.FAILED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail task: " + taskId, e);
        }
    }

    @Override
    public int cancelByDedupKey(String dedupKey, Instant now) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'CANCELLED', active_key = NULL, updated_at = ?
                    WHERE dedup_key = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, dedupKey);

            int cancelled = ps.executeUpdate();
            conn.commit();
            return cancelled;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel tasks for key: " + dedupKey, e);
        }
    }

    @Override
    public List<ScheduledTask> findExpiredLeases(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM scheduled_tasks
                    WHERE status = 'PROCESSING' AND claimed_at < ?
                    ORDER BY claimed_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, claimedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find expired leases", e);
        }
    }

    @Override
    public boolean releaseLease(String taskId, Instant claimedAt, String error, Instant now) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'PENDING', claimed_at = NULL, last_error = ?, updated_at = ?
                    WHERE id = ? AND status = 'PROCESSING' AND claimed_at = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(error));
            setTimestamp(ps, 2, now);
            ps.setString(3, taskId);
            setTimestamp(ps, 4, claimedAt);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lease for task: " + taskId, e);
        }
    }

    @Override
    public boolean failLease(String taskId, Instant claimedAt, String error, Instant now) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'FAILED', active_key = NULL, last_error = ?, executed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'PROCESSING' AND claimed_at = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(error));
            setTimestamp(ps, 2, now);
            setTimestamp(ps, 3, now);
            ps.setString(4, taskId);
            setTimestamp(ps, 5, claimedAt);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail lease for task: " + taskId, e);
        }
    }

    @Override
    public Map<TaskStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM scheduled_tasks GROUP BY status";

        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    // Helper methods

    private List<ScheduledTask> executeQuery(PreparedStatement ps) throws SQLException {
        List<ScheduledTask> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private ScheduledTask mapRow(ResultSet rs) throws SQLException {
        return ScheduledTask.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .type(TaskType.valueOf(rs.getString("task_type")))
                .dedupKey(rs.getString("dedup_key"))
                .dueAt(getInstant(rs, "due_at"))
                .payload(rs.getString("payload"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .lastError(rs.getString("last_error"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .claimedAt(getInstant(rs, "claimed_at"))
                .executedAt(getInstant(rs, "executed_at"))
                .build();
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 2000 ? error.substring(0, 2000) : error;
    }
}
