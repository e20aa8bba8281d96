package crewdesk.workflow.reschedule;

/**
 * Result of moving one job. {@code success} reflects the date change only;
 * notifications are counted separately and never affect it.
 */
public record RescheduleOutcome(boolean success, int notificationsSent, String error) {

    public static RescheduleOutcome moved(int notificationsSent) {
        return new RescheduleOutcome(true, notificationsSent, null);
    }

    public static RescheduleOutcome failed(String error) {
        return new RescheduleOutcome(false, 0, error);
    }
}
