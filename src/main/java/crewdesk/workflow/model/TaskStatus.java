package crewdesk.workflow.model;

/**
 * Scheduled task lifecycle states.
 */
public enum TaskStatus {
    /** Waiting for its due time */
    PENDING,

    /** Claimed by a worker */
    PROCESSING,

    /** Handler finished successfully */
    COMPLETED,

    /** Attempts exhausted */
    FAILED,

    /** Cancelled before it was claimed */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
