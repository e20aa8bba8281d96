package crewdesk.workflow.rainday;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Checks the forecast for an upcoming day and, if it is a rain day, clears
 * the schedule through the redistributor and texts the owner a summary.
 */
public class RainDayMonitor {

    private static final Logger log = LoggerFactory.getLogger(RainDayMonitor.class);

    private final ForecastProvider forecasts;
    private final RainDayRedistributor redistributor;
    private final NotificationService notifications;
    private final MessageComposer composer;
    private final WorkflowConfig config;
    private final Clock clock;

    public RainDayMonitor(ForecastProvider forecasts, RainDayRedistributor redistributor,
            NotificationService notifications, MessageComposer composer, WorkflowConfig config, Clock clock) {
        this.forecasts = forecasts;
        this.redistributor = redistributor;
        this.notifications = notifications;
        this.composer = composer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param zip       area to check, or null for the configured service area
     * @param daysAhead days after today (business time); 1 is tomorrow
     * @param options   reschedule options; the affected date is always the checked day
     */
    public RainDayCheckResult checkAndHandle(String zip, int daysAhead, RescheduleRequest options) {
        if (daysAhead < 0) {
            throw new IllegalArgumentException("daysAhead must not be negative");
        }
        String area = zip != null && !zip.isBlank() ? zip : config.serviceAreaZip();
        LocalDate date = LocalDate.now(clock.withZone(config.businessZone())).plusDays(daysAhead);

        Optional<DailyForecast> forecast;
        try {
            forecast = forecasts.forecast(area, date);
        } catch (RuntimeException e) {
            log.warn("Forecast lookup for {} on {} failed: {}", area, date, e.getMessage());
            return RainDayCheckResult.unchecked(date, "forecast unavailable: " + e.getMessage());
        }
        if (forecast.isEmpty()) {
            return RainDayCheckResult.unchecked(date, "no forecast for " + area + " on " + date);
        }

        DailyForecast day = forecast.get();
        if (!RainDayDetector.isRainDay(day)) {
            log.info("No rain expected in {} on {} ({})", area, date, RainDayDetector.summary(day));
            return RainDayCheckResult.dry(date, day);
        }

        log.warn("Rain day detected for {} on {}: {}", area, date, RainDayDetector.summary(day));
        RescheduleRequest request = options != null
                ? options.withAffectedDate(date)
                : RescheduleRequest.autoSpread(date);
        RescheduleResult result = redistributor.reschedule(request);

        if (result.jobsAffected() > 0) {
            notifications.smsOwner(composer.rainDaySummary(RainDayDetector.briefing(day), date,
                    result.jobsAffected(), result.jobsRescheduled(), result.jobsFailed().size(),
                    result.notificationsSent()), null);
        }
        return RainDayCheckResult.rescheduled(date, day, result);
    }
}
