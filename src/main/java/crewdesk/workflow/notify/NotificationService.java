package crewdesk.workflow.notify;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.SystemEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Best-effort notifications for synchronous flows (assignment responses,
 * rescheduling). A failed send is logged and recorded as a
 * NOTIFICATION_FAILED event; it never throws.
 */
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    private static final String SOURCE = "notifications";

    private final MessageSender sender;
    private final SystemEventLog events;
    private final WorkflowConfig config;

    public NotificationService(MessageSender sender, SystemEventLog events, WorkflowConfig config) {
        this.sender = sender;
        this.events = events;
        this.config = config;
    }

    public boolean smsCustomer(String phone, String message, Long jobId) {
        if (phone == null || phone.isBlank()) {
            log.debug("No customer phone for job {}, skipping SMS", jobId);
            return false;
        }
        return deliver(Channel.SMS, phone, message, jobId, null);
    }

    public boolean chatCleaner(Cleaner cleaner, String message, Long jobId) {
        if (cleaner == null || !cleaner.hasChat()) {
            log.debug("Cleaner has no chat id, skipping message for job {}", jobId);
            return false;
        }
        return deliver(Channel.CHAT, cleaner.chatId(), message, jobId, cleaner.id());
    }

    public boolean smsOwner(String message, Long jobId) {
        if (!config.hasOwnerPhone()) {
            log.warn("Owner phone not configured, dropping owner message for job {}", jobId);
            return false;
        }
        return deliver(Channel.SMS, config.ownerPhone(), message, jobId, null);
    }

    private boolean deliver(Channel channel, String recipient, String message, Long jobId, Long cleanerId) {
        SendResult result;
        try {
            result = sender.send(channel, recipient, message);
        } catch (RuntimeException e) {
            result = SendResult.failed(e.getMessage());
        }

        if (result.success()) {
            return true;
        }

        log.warn("{} to {} failed for job {}: {}", channel, recipient, jobId, result.error());
        events.record(SystemEventType.NOTIFICATION_FAILED, SOURCE,
                channel + " delivery failed: " + result.error(), jobId, cleanerId, recipient,
                Map.of("channel", channel.name()));
        return false;
    }
}
