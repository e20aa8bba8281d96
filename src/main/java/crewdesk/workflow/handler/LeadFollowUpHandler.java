package crewdesk.workflow.handler;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.LeadFollowUpPayload;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.OutboundCaller;
import crewdesk.workflow.notify.SendResult;
import crewdesk.workflow.scheduler.TaskExecutionException;
import crewdesk.workflow.scheduler.TaskHandler;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Runs one stage of a lead's follow-up sequence: a text, a call, or two calls
 * back to back. Any failed send fails the attempt so the task is retried.
 */
public class LeadFollowUpHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(LeadFollowUpHandler.class);
    private static final String SOURCE = "lead-follow-up";

    private final MessageSender sender;
    private final OutboundCaller caller;
    private final MessageComposer composer;
    private final SystemEventLog events;
    private final Duration doubleCallGap;

    public LeadFollowUpHandler(MessageSender sender, OutboundCaller caller, MessageComposer composer,
            SystemEventLog events, WorkflowConfig config) {
        this.sender = sender;
        this.caller = caller;
        this.composer = composer;
        this.events = events;
        this.doubleCallGap = config.doubleCallGap();
    }

    @Override
    public TaskType type() {
        return TaskType.LEAD_FOLLOW_UP;
    }

    @Override
    public void handle(ScheduledTask task) {
        LeadFollowUpPayload payload = Jsons.fromJson(task.payload(), LeadFollowUpPayload.class);

        switch (payload.action()) {
            case TEXT -> text(payload);
            case CALL -> call(payload);
            case DOUBLE_CALL -> {
                call(payload);
                pause();
                call(payload);
            }
        }

        events.record(task.tenantId(), SystemEventType.LEAD_FOLLOW_UP_EXECUTED, SOURCE,
                "Stage " + payload.stage() + " " + payload.action(), null, null, payload.phone(),
                Map.of("leadId", payload.leadId(), "stage", payload.stage(), "action", payload.action().name()));
        log.info("Lead {} stage {} done ({})", payload.leadId(), payload.stage(), payload.action());
    }

    private void text(LeadFollowUpPayload payload) {
        String message = payload.stage() == 1
                ? composer.leadGreeting(payload.name())
                : composer.leadFollowUp(payload.name(), payload.stage());
        SendResult result = sender.send(Channel.SMS, payload.phone(), message);
        if (!result.success()) {
            throw new TaskExecutionException("SMS to lead " + payload.leadId() + " failed: " + result.error());
        }
    }

    private void call(LeadFollowUpPayload payload) {
        SendResult result = caller.call(payload.phone(), payload.name(), payload.leadId());
        if (!result.success()) {
            throw new TaskExecutionException("Call to lead " + payload.leadId() + " failed: " + result.error());
        }
    }

    private void pause() {
        if (doubleCallGap.isZero() || doubleCallGap.isNegative()) {
            return;
        }
        try {
            Thread.sleep(doubleCallGap.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("Interrupted between calls", e);
        }
    }
}
