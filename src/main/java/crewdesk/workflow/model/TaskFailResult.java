package crewdesk.workflow.model;

/**
 * Result of failing a task.
 */
public enum TaskFailResult {
    /** Task failed and went back to PENDING for another attempt */
    RETRIED,

    /** Task failed permanently (max attempts reached) */
    FAILED,

    /** Task was not PROCESSING any more - nothing changed */
    ALREADY_TERMINAL,

    /** Task not found */
    NOT_FOUND
}
