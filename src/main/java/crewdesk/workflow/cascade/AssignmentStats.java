package crewdesk.workflow.cascade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Offer history of one job.
 */
public record AssignmentStats(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("totalAttempts") int totalAttempts,
        @JsonProperty("pending") int pending,
        @JsonProperty("confirmed") int confirmed,
        @JsonProperty("declined") int declined,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("cleanersContacted") List<Long> cleanersContacted) {
}
