package crewdesk.workflow.followup;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record JobBroadcastPayload(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("phase") BroadcastPhase phase,
        @JsonProperty("candidateLeadIds") List<Long> candidateLeadIds) {
}
