package crewdesk.workflow.repository;

import crewdesk.workflow.model.CleanerAssignment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for crew offers.
 * At most one assignment per job is live (PENDING or CONFIRMED); the store
 * enforces this.
 */
public interface AssignmentRepository {

    /**
     * Create a PENDING offer.
     *
     * @return the new assignment, or empty if the job already has a live one
     */
    Optional<CleanerAssignment> createPending(long jobId, long cleanerId, Double distanceMiles, Instant now);

    Optional<CleanerAssignment> findById(long assignmentId);

    /**
     * All offers for a job, oldest first.
     */
    List<CleanerAssignment> findByJobId(long jobId);

    /**
     * The PENDING or CONFIRMED offer for a job, if any.
     */
    Optional<CleanerAssignment> findLiveByJobId(long jobId);

    /**
     * PENDING to CONFIRMED.
     *
     * @return true if this call made the transition
     */
    boolean confirm(long assignmentId, Instant now);

    /**
     * PENDING to DECLINED. Frees the job for the next offer.
     *
     * @return true if this call made the transition
     */
    boolean decline(long assignmentId, Instant now);

    /**
     * PENDING to CANCELLED, for offers on a job that can no longer be staffed.
     *
     * @return true if this call made the transition
     */
    boolean cancel(long assignmentId, Instant now);

    /**
     * PENDING offers made before the cutoff.
     */
    List<CleanerAssignment> findPendingAssignedBefore(Instant cutoff);

    /**
     * Every crew member ever offered this job.
     */
    Set<Long> findContactedCleanerIds(long jobId);
}
