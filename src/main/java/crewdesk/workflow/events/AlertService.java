package crewdesk.workflow.events;

import crewdesk.workflow.model.Alert;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Raises and acknowledges owner alerts.
 */
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertRepository repository;
    private final Clock clock;

    public AlertService(AlertRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Store a new alert. Raising happens after the triggering state change has
     * been committed, so a store failure is logged rather than propagated.
     *
     * @return the stored alert, or empty if it could not be written
     */
    public Optional<Alert> raise(AlertType type, Long jobId, Integer thresholdValue, Integer actualValue,
            String message) {
        Alert alert = new Alert(0L, jobId, type, thresholdValue, actualValue, message, false, clock.instant());
        try {
            Alert saved = repository.insert(alert);
            log.info("Alert {} raised: {}", type, message);
            return Optional.of(saved);
        } catch (RuntimeException e) {
            log.error("Failed to raise {} alert for job {}", type, jobId, e);
            return Optional.empty();
        }
    }

    public List<Alert> unacknowledged(int limit) {
        return repository.findUnacknowledged(limit);
    }

    /**
     * Whether the owner still has an open alert of this type for the job.
     * A failed lookup counts as none, so the caller alerts again rather than staying silent.
     */
    public boolean hasOpenAlert(AlertType type, long jobId) {
        try {
            return repository.existsUnacknowledged(type, jobId);
        } catch (RuntimeException e) {
            log.warn("Could not check open {} alerts for job {}: {}", type, jobId, e.getMessage());
            return false;
        }
    }

    public Optional<Alert> findById(long alertId) {
        return repository.findById(alertId);
    }

    /**
     * @return true if the alert was open and is now acknowledged
     */
    public boolean acknowledge(long alertId) {
        boolean acknowledged = repository.acknowledge(alertId);
        if (acknowledged) {
            log.info("Alert {} acknowledged", alertId);
        }
        return acknowledged;
    }
}
