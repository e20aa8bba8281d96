package crewdesk.workflow.repository;

import crewdesk.workflow.model.Job;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for service jobs.
 */
public interface JobRepository {

    /**
     * Insert a job and return it with its generated id.
     */
    Job insert(Job job);

    Optional<Job> findById(long jobId);

    /**
     * Non-cancelled jobs on a date, ordered by scheduled time (unscheduled last).
     *
     * @param date     service date
     * @param tenantId tenant filter, or null for all tenants
     */
    List<Job> findActiveOnDate(LocalDate date, String tenantId);

    /**
     * Count non-cancelled jobs on a date.
     */
    int countActiveOnDate(LocalDate date, String tenantId);

    /**
     * Crew members already confirmed on some job on the date.
     */
    Set<Long> findConfirmedCleanerIdsOnDate(LocalDate date);

    /**
     * Move a job to a new service date.
     *
     * @return true if the job exists and was updated
     */
    boolean updateServiceDate(long jobId, LocalDate newDate, Instant now);

    /**
     * Record the confirmed crew member on the job.
     */
    boolean markCleanerConfirmed(long jobId, long cleanerId, Instant now);

    boolean markCustomerNotified(long jobId, Instant now);
}
