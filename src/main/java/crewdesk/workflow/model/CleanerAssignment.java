package crewdesk.workflow.model;

import java.time.Instant;

/**
 * One offer of a job to one crew member.
 */
public record CleanerAssignment(
        long id,
        long jobId,
        long cleanerId,
        AssignmentStatus status,
        Double distanceMiles,
        Instant assignedAt,
        Instant respondedAt) {

    public boolean isPending() {
        return status == AssignmentStatus.PENDING;
    }
}
