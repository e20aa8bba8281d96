package crewdesk.workflow.scheduler;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.repository.ScheduledTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers tasks stuck in PROCESSING.
 * <p>
 * A task can be stuck if the worker crashed or was killed after claiming it.
 * Once its lease is older than the configured timeout:
 * - If attempts remain: back to PENDING
 * - Otherwise: FAILED
 * Each reclaim is conditional on the lease still being the one observed, so
 * a worker that finishes in the meantime wins.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final ScheduledTaskRepository repository;
    private final WorkflowConfig config;
    private final Clock clock;

    public TaskReaper(ScheduledTaskRepository repository, WorkflowConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapExpiredLeases();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find and recover tasks whose lease expired.
     *
     * @return number of tasks recovered
     */
    public int reapExpiredLeases() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.taskLeaseTimeout());

        List<ScheduledTask> expired = repository.findExpiredLeases(cutoff);

        if (expired.isEmpty()) {
            log.debug("No expired leases");
            return 0;
        }

        int released = 0;
        int failed = 0;

        for (ScheduledTask task : expired) {
            try {
                if (task.canRetry()) {
                    if (repository.releaseLease(task.id(), task.claimedAt(), "lease expired", now)) {
                        released++;
                        log.info("Reclaimed task {} for retry (attempt {} of {})",
                                task.id(), task.attempts(), task.maxAttempts());
                    }
                } else {
                    String error = "lease expired - max attempts exceeded (" + task.attempts() + "/"
                            + task.maxAttempts() + ")";
                    if (repository.failLease(task.id(), task.claimedAt(), error, now)) {
                        failed++;
                        log.warn("Task {} permanently failed after {} attempts (lease expired)",
                                task.id(), task.attempts());
                    }
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Task reaper: {} released, {} failed, {} expired", released, failed, expired.size());

        return released + failed;
    }
}
