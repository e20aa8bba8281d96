package crewdesk.workflow.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sender and caller used when no provider is wired in. Logs every
 * message and reports success, so the workflow can run end to end locally.
 */
public class LoggingMessageSender implements MessageSender, OutboundCaller {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessageSender.class);

    @Override
    public SendResult send(Channel channel, String recipient, String message) {
        if (recipient == null || recipient.isBlank()) {
            return SendResult.failed("no recipient");
        }
        log.info("[{}] -> {}: {}", channel, recipient, message);
        return SendResult.ok();
    }

    @Override
    public SendResult call(String phone, String name, long leadId) {
        if (phone == null || phone.isBlank()) {
            return SendResult.failed("no phone number");
        }
        log.info("[CALL] -> {} ({}) for lead {}", phone, name, leadId);
        return SendResult.ok();
    }
}
