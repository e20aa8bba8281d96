package crewdesk.workflow.support;

import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.OutboundCaller;
import crewdesk.workflow.notify.SendResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every message and call. Individual recipients, or everything, can
 * be made to fail.
 */
public class RecordingMessageSender implements MessageSender, OutboundCaller {

    public record Sent(Channel channel, String recipient, String message) {
    }

    public record Call(String phone, String name, long leadId) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Set<String> failing = new HashSet<>();
    private volatile boolean failAll;

    @Override
    public SendResult send(Channel channel, String recipient, String message) {
        if (failAll || failing.contains(recipient)) {
            return SendResult.failed("provider rejected " + recipient);
        }
        sent.add(new Sent(channel, recipient, message));
        return SendResult.ok();
    }

    @Override
    public SendResult call(String phone, String name, long leadId) {
        if (failAll || failing.contains(phone)) {
            return SendResult.failed("call to " + phone + " did not connect");
        }
        calls.add(new Call(phone, name, leadId));
        return SendResult.ok();
    }

    public void failFor(String recipient) {
        failing.add(recipient);
    }

    public void failAll(boolean fail) {
        this.failAll = fail;
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<Sent> sentTo(String recipient) {
        return sent.stream().filter(s -> s.recipient().equals(recipient)).toList();
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public void clear() {
        sent.clear();
        calls.clear();
        failing.clear();
        failAll = false;
    }
}
