package crewdesk.workflow.cascade;

import crewdesk.workflow.model.Cleaner;

/**
 * A crew member who may be offered a job, with the distance from home when known.
 */
public record Candidate(Cleaner cleaner, Double distanceMiles) {
}
