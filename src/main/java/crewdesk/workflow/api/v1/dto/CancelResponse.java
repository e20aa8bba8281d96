package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CancelResponse(@JsonProperty("cancelled") int cancelled) {
}
