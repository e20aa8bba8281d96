package crewdesk.workflow.followup;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LeadFollowUpPayload(
        @JsonProperty("leadId") long leadId,
        @JsonProperty("phone") String phone,
        @JsonProperty("name") String name,
        @JsonProperty("stage") int stage,
        @JsonProperty("action") FollowUpAction action) {
}
