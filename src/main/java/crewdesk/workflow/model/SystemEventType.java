package crewdesk.workflow.model;

public enum SystemEventType {
    LEAD_FOLLOW_UP_EXECUTED,
    REMINDER_SENT,
    POST_SERVICE_FOLLOW_UP_SENT,
    CLEANER_OFFERED,
    CLEANER_ACCEPTED,
    CLEANER_DECLINED,
    OFFER_EXPIRED,
    URGENT_FOLLOW_UP_SENT,
    OWNER_ACTION_REQUIRED,
    CUSTOMER_NOTIFIED,
    NOTIFICATION_FAILED,
    JOB_RESCHEDULED,
    TASK_FAILED
}
