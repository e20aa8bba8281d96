package crewdesk.workflow.rainday;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk reschedule. {@code targetDate} is "auto-spread" in spread mode.
 */
public record RescheduleResult(
        @JsonProperty("affectedDate") LocalDate affectedDate,
        @JsonProperty("targetDate") String targetDate,
        @JsonProperty("jobsAffected") int jobsAffected,
        @JsonProperty("jobsRescheduled") int jobsRescheduled,
        @JsonProperty("jobsFailed") List<Long> jobsFailed,
        @JsonProperty("notificationsSent") int notificationsSent,
        @JsonProperty("spreadSummary") Map<LocalDate, Integer> spreadSummary) {

    public static final String AUTO_SPREAD = "auto-spread";
}
