package crewdesk.workflow.model;

import java.time.Instant;

/**
 * Owner-facing notice. Immutable apart from the acknowledged flag.
 */
public record Alert(
        long id,
        Long jobId,
        AlertType type,
        Integer thresholdValue,
        Integer actualValue,
        String message,
        boolean acknowledged,
        Instant createdAt) {
}
