package crewdesk.workflow.scheduler;

/**
 * Thrown by a task handler when the attempt failed and the task should be
 * retried (or failed once attempts run out).
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message) {
        super(message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
