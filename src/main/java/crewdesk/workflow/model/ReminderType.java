package crewdesk.workflow.model;

/**
 * Crew reminders sent before a visit.
 */
public enum ReminderType {
    ONE_HOUR("one-hour"),
    JOB_START("job-start");

    private final String keySuffix;

    ReminderType(String keySuffix) {
        this.keySuffix = keySuffix;
    }

    /** Fragment used in dedup keys */
    public String keySuffix() {
        return keySuffix;
    }
}
