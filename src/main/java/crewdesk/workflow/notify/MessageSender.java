package crewdesk.workflow.notify;

/**
 * Sends a text message on a channel. Implementations report delivery problems
 * through {@link SendResult} instead of throwing.
 */
public interface MessageSender {

    SendResult send(Channel channel, String recipient, String message);
}
