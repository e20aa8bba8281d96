package crewdesk.workflow.cascade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import crewdesk.workflow.model.AssignmentStatus;

/**
 * Outcome of a crew member answering an offer.
 * {@code nextOffer} is set after a decline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseResult(
        @JsonProperty("status") Status status,
        @JsonProperty("assignmentId") long assignmentId,
        @JsonProperty("assignmentStatus") AssignmentStatus assignmentStatus,
        @JsonProperty("nextOffer") OfferResult nextOffer) {

    public enum Status {
        ACCEPTED,
        DECLINED,
        /** The offer was already answered, expired or cancelled */
        ALREADY_SETTLED,
        NOT_FOUND
    }

    public static ResponseResult accepted(long assignmentId) {
        return new ResponseResult(Status.ACCEPTED, assignmentId, AssignmentStatus.CONFIRMED, null);
    }

    public static ResponseResult declined(long assignmentId, OfferResult nextOffer) {
        return new ResponseResult(Status.DECLINED, assignmentId, AssignmentStatus.DECLINED, nextOffer);
    }

    public static ResponseResult alreadySettled(long assignmentId, AssignmentStatus current) {
        return new ResponseResult(Status.ALREADY_SETTLED, assignmentId, current, null);
    }

    public static ResponseResult notFound(long assignmentId) {
        return new ResponseResult(Status.NOT_FOUND, assignmentId, null, null);
    }
}
