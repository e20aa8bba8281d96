package crewdesk.workflow.model;

/**
 * Status of a crew offer. PENDING and CONFIRMED count as live.
 */
public enum AssignmentStatus {
    PENDING,
    CONFIRMED,
    DECLINED,
    CANCELLED;

    public boolean isLive() {
        return this == PENDING || this == CONFIRMED;
    }
}
