package crewdesk.workflow.model;

/**
 * Service job lifecycle as seen by the workflow core.
 */
public enum JobStatus {
    PENDING,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Jobs in these states can still receive a crew member */
    public boolean isAssignable() {
        return this != COMPLETED && this != CANCELLED;
    }
}
