package crewdesk.workflow.rainday;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of daily weather forecasts.
 */
public interface ForecastProvider {

    /**
     * @return the forecast, or empty when the provider has none for that day
     * @throws RuntimeException when the provider cannot be reached
     */
    Optional<DailyForecast> forecast(String zip, LocalDate date);
}
