package crewdesk.workflow.rainday;

import java.util.ArrayList;
import java.util.List;

/**
 * Weather thresholds for outdoor work.
 */
public final class RainDayDetector {

    static final int RAIN_CHANCE_THRESHOLD = 50;
    static final double RAIN_INCHES_THRESHOLD = 0.1;
    static final double BAD_WIND_MPH = 25;

    private static final int SUMMARY_RAIN_CHANCE = 30;
    private static final double SUMMARY_WIND_MPH = 15;
    private static final double BRIEFING_WIND_MPH = 20;

    private RainDayDetector() {
    }

    public static boolean isRainDay(DailyForecast forecast) {
        return forecast.precipitationChance() >= RAIN_CHANCE_THRESHOLD
                || forecast.precipitationInches() >= RAIN_INCHES_THRESHOLD;
    }

    /**
     * Rain, or wind strong enough to cancel outdoor work.
     */
    public static boolean isBadWeather(DailyForecast forecast) {
        return isRainDay(forecast) || forecast.windMph() >= BAD_WIND_MPH;
    }

    public static String summary(DailyForecast forecast) {
        List<String> parts = new ArrayList<>();
        if (forecast.conditions() != null && !forecast.conditions().isBlank()) {
            parts.add(forecast.conditions());
        }
        parts.add("High " + forecast.highTempF() + "°F");
        if (forecast.precipitationChance() >= SUMMARY_RAIN_CHANCE) {
            parts.add(forecast.precipitationChance() + "% chance of rain");
        }
        if (forecast.windMph() >= SUMMARY_WIND_MPH) {
            parts.add("Wind " + Math.round(forecast.windMph()) + " mph");
        }
        return String.join(", ", parts);
    }

    /**
     * Multi-line weather section for the owner's summary message.
     */
    public static String briefing(DailyForecast forecast) {
        StringBuilder sb = new StringBuilder("Weather: ").append(summary(forecast));
        if (isRainDay(forecast)) {
            sb.append("\nRAIN DAY - ").append(forecast.precipitationChance()).append("% chance of rain");
        }
        if (forecast.windMph() >= BRIEFING_WIND_MPH) {
            sb.append("\nHigh winds expected: ").append(Math.round(forecast.windMph())).append(" mph");
        }
        return sb.toString();
    }
}
