package crewdesk.workflow.followup;

/**
 * What a lead follow-up stage does.
 */
public enum FollowUpAction {
    TEXT,
    CALL,
    /** Two calls in a row, separated by a short gap */
    DOUBLE_CALL
}
