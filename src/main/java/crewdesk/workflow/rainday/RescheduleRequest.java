package crewdesk.workflow.rainday;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Bulk reschedule request for one affected date.
 * Missing options fall back to auto-spread over 14 days with notifications on.
 */
public record RescheduleRequest(
        @JsonProperty("affectedDate") LocalDate affectedDate,
        @JsonProperty("targetDate") LocalDate targetDate,
        @JsonProperty("autoSpread") Boolean autoSpread,
        @JsonProperty("spreadDays") Integer spreadDays,
        @JsonProperty("sendNotifications") Boolean sendNotifications,
        @JsonProperty("tenantId") String tenantId) {

    public static RescheduleRequest autoSpread(LocalDate affectedDate) {
        return new RescheduleRequest(affectedDate, null, true, null, true, null);
    }

    public static RescheduleRequest toDate(LocalDate affectedDate, LocalDate targetDate) {
        return new RescheduleRequest(affectedDate, targetDate, false, null, true, null);
    }

    public RescheduleRequest withAffectedDate(LocalDate date) {
        return new RescheduleRequest(date, targetDate, autoSpread, spreadDays, sendNotifications, tenantId);
    }

    public void validate() {
        if (affectedDate == null) {
            throw new IllegalArgumentException("affectedDate is required");
        }
        if (targetDate != null && !targetDate.isAfter(affectedDate)) {
            throw new IllegalArgumentException("targetDate must be after affectedDate");
        }
    }

    /**
     * Single-target mode applies when a target is given or spreading is turned off.
     */
    public boolean singleTarget() {
        return targetDate != null || Boolean.FALSE.equals(autoSpread);
    }

    public LocalDate resolvedTargetDate() {
        return targetDate != null ? targetDate : CandidateDates.nextWorkday(affectedDate);
    }

    public int resolvedSpreadDays() {
        return CandidateDates.clampSpreadDays(spreadDays);
    }

    public boolean notificationsEnabled() {
        return !Boolean.FALSE.equals(sendNotifications);
    }
}
