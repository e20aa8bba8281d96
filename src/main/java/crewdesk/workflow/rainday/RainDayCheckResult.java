package crewdesk.workflow.rainday;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RainDayCheckResult(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("checked") boolean checked,
        @JsonProperty("rainDay") boolean rainDay,
        @JsonProperty("forecast") DailyForecast forecast,
        @JsonProperty("rescheduled") RescheduleResult rescheduled,
        @JsonProperty("error") String error) {

    static RainDayCheckResult unchecked(LocalDate date, String error) {
        return new RainDayCheckResult(date, false, false, null, null, error);
    }

    static RainDayCheckResult dry(LocalDate date, DailyForecast forecast) {
        return new RainDayCheckResult(date, true, false, forecast, null, null);
    }

    static RainDayCheckResult rescheduled(LocalDate date, DailyForecast forecast, RescheduleResult result) {
        return new RainDayCheckResult(date, true, true, forecast, result, null);
    }
}
