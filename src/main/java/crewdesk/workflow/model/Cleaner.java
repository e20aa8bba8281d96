package crewdesk.workflow.model;

/**
 * Crew member. {@code chatId} is the messenger recipient used for offers;
 * home coordinates are optional.
 */
public record Cleaner(
        long id,
        String tenantId,
        String name,
        String phone,
        String chatId,
        boolean active,
        boolean teamLead,
        Double homeLatitude,
        Double homeLongitude) {

    public boolean hasHomeLocation() {
        return homeLatitude != null && homeLongitude != null;
    }

    public boolean hasChat() {
        return chatId != null && !chatId.isBlank();
    }
}
