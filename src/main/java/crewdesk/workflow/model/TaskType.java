package crewdesk.workflow.model;

/**
 * Kinds of scheduled work. Every type has exactly one registered handler.
 */
public enum TaskType {
    LEAD_FOLLOW_UP,
    JOB_BROADCAST,
    DAY_BEFORE_REMINDER,
    JOB_REMINDER,
    POST_SERVICE_FOLLOW_UP
}
