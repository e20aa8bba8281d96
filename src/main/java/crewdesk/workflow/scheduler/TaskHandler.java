package crewdesk.workflow.scheduler;

import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskType;

/**
 * Executes one kind of scheduled task.
 * Returning normally completes the task; throwing fails the attempt.
 */
public interface TaskHandler {

    TaskType type();

    void handle(ScheduledTask task);
}
