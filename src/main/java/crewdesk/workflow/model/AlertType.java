package crewdesk.workflow.model;

public enum AlertType {
    CLEANERS_EXHAUSTED,
    RAIN_DAY_RESCHEDULE,
    TASK_FAILED
}
