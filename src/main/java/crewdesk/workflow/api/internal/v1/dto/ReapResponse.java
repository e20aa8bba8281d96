package crewdesk.workflow.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of POST /internal/v1/tasks/reap.
 */
public record ReapResponse(@JsonProperty("reclaimed") int reclaimed) {
}
