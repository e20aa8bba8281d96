package crewdesk.workflow.notify;

/**
 * Outbound message channels. CHAT is the crew messenger.
 */
public enum Channel {
    SMS,
    CHAT
}
