package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * POST /api/v1/jobs/{jobId}/broadcast
 */
public record JobBroadcastRequest(
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("candidateLeadIds") List<Long> candidateLeadIds) {
}
