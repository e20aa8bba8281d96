package crewdesk.workflow.repository;

import crewdesk.workflow.model.ScheduleResult;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskFailResult;
import crewdesk.workflow.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for the durable task queue.
 * All state transitions are conditional on the current status, so concurrent
 * callers never both win the same transition.
 */
public interface ScheduledTaskRepository {

    /**
     * Insert a new PENDING task.
     * If the task has a dedup key and a live (PENDING or PROCESSING) task with
     * the same key exists, nothing is inserted and the existing id is returned.
     *
     * @param task the task to insert
     * @return the id of the inserted or existing task
     */
    ScheduleResult insert(ScheduledTask task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<ScheduledTask> findById(String taskId);

    /**
     * Find the live task holding a dedup key.
     *
     * @param dedupKey the dedup key
     * @return the PENDING or PROCESSING task, if any
     */
    Optional<ScheduledTask> findLiveByDedupKey(String dedupKey);

    /**
     * PENDING tasks with dueAt at or before {@code now}, oldest due first.
     *
     * @param now   current time
     * @param limit maximum number of results
     * @return due tasks
     */
    List<ScheduledTask> findDue(Instant now, int limit);

    /**
     * Atomically move a task from PENDING to PROCESSING, incrementing attempts.
     *
     * @param taskId the task ID
     * @param now    claim time, stored as the lease start
     * @return the claimed task, or empty if another worker got it first
     */
    Optional<ScheduledTask> claim(String taskId, Instant now);

    /**
     * PROCESSING to COMPLETED.
     *
     * @return true if this call made the transition
     */
    boolean complete(String taskId, Instant now);

    /**
     * Record a failed attempt. Goes back to PENDING while attempts remain,
     * otherwise FAILED.
     *
     * @param taskId     the task ID
     * @param error      error message to store
     * @param now        current time
     * @param retryDueAt new due time for a retry, or null to keep the old one
     * @return outcome of the failure
     */
    TaskFailResult fail(String taskId, String error, Instant now, Instant retryDueAt);

    /**
     * Cancel PENDING tasks with the given dedup key.
     *
     * @return number of tasks cancelled
     */
    int cancelByDedupKey(String dedupKey, Instant now);

    /**
     * PROCESSING tasks whose lease started before the cutoff.
     */
    List<ScheduledTask> findExpiredLeases(Instant claimedBefore);

    /**
     * Return an expired lease to PENDING. Only succeeds if the task is still
     * PROCESSING under the same lease.
     */
    boolean releaseLease(String taskId, Instant claimedAt, String error, Instant now);

    /**
     * Fail an expired lease permanently. Same conditions as {@link #releaseLease}.
     */
    boolean failLease(String taskId, Instant claimedAt, String error, Instant now);

    /**
     * Count tasks per status. Statuses with no tasks are reported as zero.
     */
    Map<TaskStatus, Integer> countByStatus();
}
