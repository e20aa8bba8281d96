package crewdesk.workflow.model;

import java.time.Instant;

/**
 * Append-only audit entry. {@code metadata} is JSON text.
 */
public record SystemEvent(
        long id,
        String tenantId,
        String source,
        SystemEventType type,
        String message,
        Long jobId,
        Long cleanerId,
        String phone,
        String metadata,
        Instant createdAt) {
}
