package crewdesk.workflow.cascade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of trying to offer a job to the next crew member.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OfferResult(
        @JsonProperty("status") Status status,
        @JsonProperty("assignmentId") Long assignmentId,
        @JsonProperty("cleanerId") Long cleanerId,
        @JsonProperty("message") String message) {

    public enum Status {
        /** A new PENDING offer was created */
        OFFERED,
        /** The job already has a PENDING offer */
        ALREADY_OFFERED,
        /** The job already has a confirmed crew member */
        ALREADY_CONFIRMED,
        /** Nobody left to ask */
        EXHAUSTED,
        /** Unknown, completed or cancelled job */
        JOB_NOT_ASSIGNABLE
    }

    public static OfferResult offered(long assignmentId, long cleanerId) {
        return new OfferResult(Status.OFFERED, assignmentId, cleanerId, null);
    }

    public static OfferResult alreadyOffered(Long assignmentId, Long cleanerId) {
        return new OfferResult(Status.ALREADY_OFFERED, assignmentId, cleanerId, "an offer is already pending");
    }

    public static OfferResult alreadyConfirmed(Long assignmentId, Long cleanerId) {
        return new OfferResult(Status.ALREADY_CONFIRMED, assignmentId, cleanerId, "a cleaner is already confirmed");
    }

    public static OfferResult exhausted() {
        return new OfferResult(Status.EXHAUSTED, null, null, "no eligible cleaners left");
    }

    public static OfferResult notAssignable(String message) {
        return new OfferResult(Status.JOB_NOT_ASSIGNABLE, null, null, message);
    }

    public boolean isOffered() {
        return status == Status.OFFERED;
    }
}
