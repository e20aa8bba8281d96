package crewdesk.workflow.rainday;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Forecast for one day at one location. Temperatures in °F, wind in mph,
 * precipitation amount in inches.
 */
public record DailyForecast(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("conditions") String conditions,
        @JsonProperty("highTempF") int highTempF,
        @JsonProperty("precipitationChance") int precipitationChance,
        @JsonProperty("precipitationInches") double precipitationInches,
        @JsonProperty("windMph") double windMph) {
}
