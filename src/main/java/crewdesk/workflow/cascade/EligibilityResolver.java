package crewdesk.workflow.cascade;

import crewdesk.workflow.model.Job;

import java.util.Optional;
import java.util.Set;

/**
 * Chooses who gets offered a job next.
 */
public interface EligibilityResolver {

    /**
     * @param job                the job to staff
     * @param excludedCleanerIds crew members already contacted for this job
     * @return the best remaining candidate, or empty when nobody is left
     */
    Optional<Candidate> nextCandidate(Job job, Set<Long> excludedCleanerIds);
}
