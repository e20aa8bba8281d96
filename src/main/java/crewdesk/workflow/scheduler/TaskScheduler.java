package crewdesk.workflow.scheduler;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.model.ScheduleResult;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskFailResult;
import crewdesk.workflow.model.TaskStatus;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.repository.ScheduledTaskRepository;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable at-least-once scheduler over the task store.
 * <p>
 * Expected races (a claim lost to another worker, completing a task that
 * was reclaimed) are reported through return values, never exceptions.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledTaskRepository repository;
    private final WorkflowConfig config;
    private final Clock clock;

    public TaskScheduler(ScheduledTaskRepository repository, WorkflowConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Schedule a task with the default attempt limit and no tenant.
     */
    public ScheduleResult schedule(TaskType type, String dedupKey, Instant dueAt, Object payload) {
        return schedule(type, dedupKey, dueAt, payload, config.defaultMaxAttempts(), null);
    }

    /**
     * Schedule a task.
     *
     * @param type        task type
     * @param dedupKey    optional key; a live task with the same key makes this a no-op
     * @param dueAt       earliest execution time (a past time runs on the next poll)
     * @param payload     payload object, serialized to JSON
     * @param maxAttempts attempts before the task is failed permanently
     * @param tenantId    optional tenant
     * @return the new task id, or the existing one on a dedup hit
     */
    public ScheduleResult schedule(TaskType type, String dedupKey, Instant dueAt, Object payload,
            int maxAttempts, String tenantId) {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (dueAt == null) {
            throw new IllegalArgumentException("dueAt is required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (dedupKey != null && dedupKey.isBlank()) {
            throw new IllegalArgumentException("dedupKey must not be blank");
        }

        Instant now = clock.instant();
        ScheduledTask task = ScheduledTask.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .type(type)
                .dedupKey(dedupKey)
                .dueAt(dueAt)
                .payload(payload instanceof String s ? s : Jsons.toJson(payload))
                .maxAttempts(maxAttempts)
                .createdAt(now)
                .build();

        ScheduleResult result = repository.insert(task);
        if (result.created()) {
            log.info("Scheduled {} task {} due {} (key={})", type, result.taskId(), dueAt, dedupKey);
        } else {
            log.debug("Task with key {} already live as {}", dedupKey, result.taskId());
        }
        return result;
    }

    /**
     * Cancel the PENDING task holding a dedup key.
     *
     * @return number of tasks cancelled (0 when nothing matched)
     */
    public int cancel(String dedupKey) {
        int cancelled = repository.cancelByDedupKey(dedupKey, clock.instant());
        if (cancelled > 0) {
            log.info("Cancelled {} task(s) with key {}", cancelled, dedupKey);
        }
        return cancelled;
    }

    public int cancelAll(Collection<String> dedupKeys) {
        int total = 0;
        for (String key : dedupKeys) {
            total += cancel(key);
        }
        return total;
    }

    public List<ScheduledTask> dueTasks(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return repository.findDue(clock.instant(), limit);
    }

    /**
     * Claim a PENDING task for execution.
     *
     * @return the claimed task, or empty if another worker got it first
     */
    public Optional<ScheduledTask> claim(String taskId) {
        return repository.claim(taskId, clock.instant());
    }

    public boolean complete(String taskId) {
        boolean completed = repository.complete(taskId, clock.instant());
        if (!completed) {
            log.warn("Task {} was not PROCESSING when completing", taskId);
        }
        return completed;
    }

    /**
     * Record a failed attempt. With a retry backoff configured the next attempt
     * is pushed out by that amount; otherwise the original due time stays.
     */
    public TaskFailResult fail(String taskId, String error) {
        Instant now = clock.instant();
        Instant retryDueAt = config.retryBackoff().isZero() ? null : now.plus(config.retryBackoff());
        TaskFailResult result = repository.fail(taskId, error, now, retryDueAt);

        switch (result) {
            case RETRIED -> log.info("Task {} failed, will retry: {}", taskId, error);
            case FAILED -> log.warn("Task {} failed permanently: {}", taskId, error);
            case ALREADY_TERMINAL, NOT_FOUND -> log.debug("Ignored failure for task {}: {}", taskId, result);
        }
        return result;
    }

    public Optional<ScheduledTask> findById(String taskId) {
        return repository.findById(taskId);
    }

    public Optional<ScheduledTask> findByDedupKey(String dedupKey) {
        return repository.findLiveByDedupKey(dedupKey);
    }

    public Map<TaskStatus, Integer> countByStatus() {
        return repository.countByStatus();
    }
}
