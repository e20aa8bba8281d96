package crewdesk.workflow.followup;

/**
 * Phases of a job broadcast, with their offset from scheduling time.
 */
public enum BroadcastPhase {
    INITIAL("initial", 0),
    URGENT("urgent", 10),
    ESCALATE("escalate", 20);

    private final String keySuffix;
    private final int offsetMinutes;

    BroadcastPhase(String keySuffix, int offsetMinutes) {
        this.keySuffix = keySuffix;
        this.offsetMinutes = offsetMinutes;
    }

    public String keySuffix() {
        return keySuffix;
    }

    public int offsetMinutes() {
        return offsetMinutes;
    }
}
