package crewdesk.workflow.repository;

import crewdesk.workflow.model.Alert;
import crewdesk.workflow.model.AlertType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for owner alerts.
 */
public interface AlertRepository {

    Alert insert(Alert alert);

    Optional<Alert> findById(long alertId);

    /**
     * Unacknowledged alerts, newest first.
     */
    List<Alert> findUnacknowledged(int limit);

    /**
     * Whether an unacknowledged alert of this type exists for the job.
     */
    boolean existsUnacknowledged(AlertType type, long jobId);

    /**
     * Flip the acknowledged flag.
     *
     * @return true if the alert existed and was not yet acknowledged
     */
    boolean acknowledge(long alertId);
}
