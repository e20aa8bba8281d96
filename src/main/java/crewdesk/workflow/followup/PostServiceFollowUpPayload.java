package crewdesk.workflow.followup;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PostServiceFollowUpPayload(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("phone") String phone,
        @JsonProperty("name") String name) {
}
