package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import crewdesk.workflow.rainday.RescheduleRequest;

/**
 * POST /api/v1/rain-day/check
 * All fields are optional.
 */
public record RainDayCheckRequest(
        @JsonProperty("zip") String zip,
        @JsonProperty("daysAhead") Integer daysAhead,
        @JsonProperty("autoSpread") Boolean autoSpread,
        @JsonProperty("spreadDays") Integer spreadDays,
        @JsonProperty("sendNotifications") Boolean sendNotifications,
        @JsonProperty("tenantId") String tenantId) {

    public static final int DEFAULT_DAYS_AHEAD = 1;
    public static final int MAX_DAYS_AHEAD = 14;

    public int resolvedDaysAhead() {
        int days = daysAhead != null ? daysAhead : DEFAULT_DAYS_AHEAD;
        if (days < 0 || days > MAX_DAYS_AHEAD) {
            throw new IllegalArgumentException("daysAhead must be between 0 and " + MAX_DAYS_AHEAD);
        }
        return days;
    }

    /**
     * Reschedule options for the checked day; the date itself is filled in by the monitor.
     */
    public RescheduleRequest options() {
        return new RescheduleRequest(null, null, autoSpread, spreadDays, sendNotifications, tenantId);
    }
}
