package crewdesk.workflow.handler;

import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.PostServiceFollowUpPayload;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.SendResult;
import crewdesk.workflow.scheduler.TaskExecutionException;
import crewdesk.workflow.scheduler.TaskHandler;
import crewdesk.workflow.util.Jsons;

import java.util.Map;

public class PostServiceFollowUpHandler implements TaskHandler {

    private static final String SOURCE = "post-service";

    private final MessageSender sender;
    private final MessageComposer composer;
    private final SystemEventLog events;

    public PostServiceFollowUpHandler(MessageSender sender, MessageComposer composer, SystemEventLog events) {
        this.sender = sender;
        this.composer = composer;
        this.events = events;
    }

    @Override
    public TaskType type() {
        return TaskType.POST_SERVICE_FOLLOW_UP;
    }

    @Override
    public void handle(ScheduledTask task) {
        PostServiceFollowUpPayload payload = Jsons.fromJson(task.payload(), PostServiceFollowUpPayload.class);

        SendResult result = sender.send(Channel.SMS, payload.phone(), composer.postServiceFollowUp(payload.name()));
        if (!result.success()) {
            throw new TaskExecutionException("Follow-up SMS for job " + payload.jobId() + " failed: "
                    + result.error());
        }

        events.record(task.tenantId(), SystemEventType.POST_SERVICE_FOLLOW_UP_SENT, SOURCE, "Thank-you message sent",
                payload.jobId(), null, payload.phone(), Map.of());
    }
}
