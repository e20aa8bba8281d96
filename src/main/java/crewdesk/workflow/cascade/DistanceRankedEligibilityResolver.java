package crewdesk.workflow.cascade;

import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the closest available crew member.
 * <p>
 * Available means active, not yet contacted for this job and not already
 * confirmed on another job the same day. When the job has coordinates,
 * candidates are ranked by great-circle distance from home, with crew members
 * without a home location last; otherwise roster order is kept.
 */
public class DistanceRankedEligibilityResolver implements EligibilityResolver {

    static final double EARTH_RADIUS_MILES = 3958.8;

    private final CleanerRepository cleaners;
    private final JobRepository jobs;

    public DistanceRankedEligibilityResolver(CleanerRepository cleaners, JobRepository jobs) {
        this.cleaners = cleaners;
        this.jobs = jobs;
    }

    @Override
    public Optional<Candidate> nextCandidate(Job job, Set<Long> excludedCleanerIds) {
        Set<Long> busy = jobs.findConfirmedCleanerIdsOnDate(job.serviceDate());

        List<Candidate> candidates = new ArrayList<>();
        for (Cleaner cleaner : cleaners.findActive(job.tenantId())) {
            if (excludedCleanerIds.contains(cleaner.id()) || busy.contains(cleaner.id())) {
                continue;
            }
            Double distance = null;
            if (job.hasLocation() && cleaner.hasHomeLocation()) {
                distance = haversineMiles(job.latitude(), job.longitude(),
                        cleaner.homeLatitude(), cleaner.homeLongitude());
            }
            candidates.add(new Candidate(cleaner, distance));
        }

        if (job.hasLocation()) {
            // List.sort is stable, so equal distances keep roster order
            candidates.sort(Comparator.comparing(Candidate::distanceMiles,
                    Comparator.nullsLast(Comparator.naturalOrder())));
        }

        return candidates.stream().findFirst();
    }

    /**
     * Great-circle distance between two points, in miles.
     */
    static double haversineMiles(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }
}
