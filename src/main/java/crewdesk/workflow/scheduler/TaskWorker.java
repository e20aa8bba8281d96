package crewdesk.workflow.scheduler;

import crewdesk.workflow.events.AlertService;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskFailResult;
import crewdesk.workflow.scheduler.PollSummary.Outcome;
import crewdesk.workflow.scheduler.PollSummary.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains due tasks: claim, dispatch, then complete or fail each one.
 * Tasks run one at a time, oldest due first.
 */
public class TaskWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);
    private static final String SOURCE = "task-worker";

    private final TaskScheduler scheduler;
    private final TaskDispatcher dispatcher;
    private final AlertService alerts;
    private final SystemEventLog events;
    private final int batchSize;

    public TaskWorker(TaskScheduler scheduler, TaskDispatcher dispatcher, AlertService alerts,
            SystemEventLog events, int batchSize) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.alerts = alerts;
        this.events = events;
        this.batchSize = batchSize;
    }

    @Override
    public void run() {
        try {
            PollSummary summary = pollOnce(batchSize);
            if (summary.processed() > 0) {
                log.info("Task poll: {} processed, {} succeeded, {} failed, {} skipped",
                        summary.processed(), summary.succeeded(), summary.failed(), summary.skipped());
            }
        } catch (Exception e) {
            log.error("Task worker error", e);
        }
    }

    /**
     * Process up to {@code limit} due tasks.
     */
    public PollSummary pollOnce(int limit) {
        List<ScheduledTask> due = scheduler.dueTasks(limit);
        if (due.isEmpty()) {
            log.debug("No due tasks");
            return new PollSummary(0, 0, 0, 0, List.of());
        }

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        List<TaskOutcome> details = new ArrayList<>();

        for (ScheduledTask candidate : due) {
            Optional<ScheduledTask> claimed = scheduler.claim(candidate.id());
            if (claimed.isEmpty()) {
                skipped++;
                details.add(new TaskOutcome(candidate.id(), candidate.type(), Outcome.SKIPPED, null));
                continue;
            }

            ScheduledTask task = claimed.get();
            try {
                dispatcher.dispatch(task);
                scheduler.complete(task.id());
                succeeded++;
                details.add(new TaskOutcome(task.id(), task.type(), Outcome.COMPLETED, null));
            } catch (RuntimeException e) {
                failed++;
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Task {} ({}) attempt {}/{} failed: {}",
                        task.id(), task.type(), task.attempts(), task.maxAttempts(), error);

                TaskFailResult result = scheduler.fail(task.id(), error);
                if (result == TaskFailResult.FAILED) {
                    onPermanentFailure(task, error);
                    details.add(new TaskOutcome(task.id(), task.type(), Outcome.FAILED, error));
                } else {
                    details.add(new TaskOutcome(task.id(), task.type(), Outcome.RETRYING, error));
                }
            }
        }

        return new PollSummary(due.size(), succeeded, failed, skipped, details);
    }

    private void onPermanentFailure(ScheduledTask task, String error) {
        String message = task.type() + " task " + task.id() + " failed after " + task.attempts()
                + " attempts: " + error;
        alerts.raise(AlertType.TASK_FAILED, null, task.maxAttempts(), task.attempts(), message);
        events.record(task.tenantId(), SystemEventType.TASK_FAILED, SOURCE, message, null, null, null,
                Map.of("taskId", task.id(), "type", task.type().name(),
                        "dedupKey", task.dedupKey() != null ? task.dedupKey() : ""));
    }
}
