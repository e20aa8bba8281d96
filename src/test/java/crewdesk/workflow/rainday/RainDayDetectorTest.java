package crewdesk.workflow.rainday;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RainDayDetectorTest {

    private static DailyForecast forecast(String conditions, int chance, double inches, double wind) {
        return new DailyForecast(LocalDate.of(2025, 3, 10), conditions, 58, chance, inches, wind);
    }

    @Test
    void eitherChanceOrAmountMakesARainDay() {
        assertFalse(RainDayDetector.isRainDay(forecast("Cloudy", 49, 0.0, 5)));
        assertTrue(RainDayDetector.isRainDay(forecast("Rain", 50, 0.0, 5)));
        assertTrue(RainDayDetector.isRainDay(forecast("Drizzle", 10, 0.1, 5)));
        assertFalse(RainDayDetector.isRainDay(forecast("Drizzle", 10, 0.09, 5)));
    }

    @Test
    void strongWindIsBadWeatherButNotRain() {
        DailyForecast windy = forecast("Windy", 0, 0.0, 25);

        assertFalse(RainDayDetector.isRainDay(windy));
        assertTrue(RainDayDetector.isBadWeather(windy));
        assertFalse(RainDayDetector.isBadWeather(forecast("Breezy", 0, 0.0, 24.9)));
    }

    @Test
    void summaryListsOnlyNotableConditions() {
        assertEquals("Partly Cloudy, High 58°F", RainDayDetector.summary(forecast("Partly Cloudy", 20, 0.0, 10)));
        assertEquals("Rain, High 58°F, 60% chance of rain, Wind 18 mph",
                RainDayDetector.summary(forecast("Rain", 60, 0.4, 18)));
        assertEquals("High 58°F, 30% chance of rain", RainDayDetector.summary(forecast(null, 30, 0.0, 0)));
    }

    @Test
    void briefingFlagsRainAndHighWinds() {
        String briefing = RainDayDetector.briefing(forecast("Rain", 60, 0.4, 22));

        assertEquals("Weather: Rain, High 58°F, 60% chance of rain, Wind 22 mph\n"
                + "RAIN DAY - 60% chance of rain\n"
                + "High winds expected: 22 mph", briefing);
        assertEquals("Weather: Sunny, High 58°F", RainDayDetector.briefing(forecast("Sunny", 0, 0.0, 3)));
    }
}
