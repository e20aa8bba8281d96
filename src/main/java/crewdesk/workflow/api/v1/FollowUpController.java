package crewdesk.workflow.api.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.api.v1.dto.CancelResponse;
import crewdesk.workflow.api.v1.dto.DayBeforeReminderRequest;
import crewdesk.workflow.api.v1.dto.JobBroadcastRequest;
import crewdesk.workflow.api.v1.dto.LeadFollowUpRequest;
import crewdesk.workflow.api.v1.dto.ScheduleResponse;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.model.ScheduleResult;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for follow-up plans.
 * POST   /api/v1/leads/{leadId}/follow-up - Plan the lead sequence
 * DELETE /api/v1/leads/{leadId}/follow-up - Cancel what is still pending
 * POST   /api/v1/jobs/{jobId}/broadcast - Plan the broadcast phases
 * POST   /api/v1/jobs/{jobId}/reminders/day-before - Plan the customer reminder
 */
public class FollowUpController implements Controller {

    private static final Pattern LEAD_PATTERN = Pattern.compile("^/api/v1/leads/([^/]+)/follow-up$");
    private static final Pattern BROADCAST_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/broadcast$");
    private static final Pattern REMINDER_PATTERN =
            Pattern.compile("^/api/v1/jobs/([^/]+)/reminders/day-before$");

    private final FollowUpSequencer sequencer;

    public FollowUpController(FollowUpSequencer sequencer) {
        this.sequencer = sequencer;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (LEAD_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST)
                && (BROADCAST_PATTERN.matcher(path).matches() || REMINDER_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher lead = LEAD_PATTERN.matcher(path);
        if (lead.matches()) {
            long leadId = Controller.pathId(lead.group(1), "leadId");
            if (req.method().equals(HttpMethod.DELETE)) {
                return ControllerResponse.json(new CancelResponse(sequencer.cancelLeadFollowUp(leadId)));
            }
            return planLead(req, leadId);
        }

        Matcher broadcast = BROADCAST_PATTERN.matcher(path);
        if (broadcast.matches()) {
            return planBroadcast(req, Controller.pathId(broadcast.group(1), "jobId"));
        }

        Matcher reminder = REMINDER_PATTERN.matcher(path);
        if (reminder.matches()) {
            return planReminder(req, Controller.pathId(reminder.group(1), "jobId"));
        }

        return ControllerResponse.notFound("unknown follow-up endpoint");
    }

    private ControllerResponse planLead(FullHttpRequest req, long leadId) {
        LeadFollowUpRequest request = Controller.readBody(req, LeadFollowUpRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        request.validate();

        List<ScheduleResult> results = request.delaysMinutes() != null
                ? sequencer.scheduleLeadFollowUp(request.tenantId(), leadId, request.phone(), request.name(),
                        request.delaysMinutes())
                : sequencer.scheduleLeadFollowUp(request.tenantId(), leadId, request.phone(), request.name());
        return ControllerResponse.json(HttpResponseStatus.CREATED, ScheduleResponse.from(results));
    }

    private ControllerResponse planBroadcast(FullHttpRequest req, long jobId) {
        JobBroadcastRequest request = Controller.readBody(req, JobBroadcastRequest.class);
        String tenantId = request != null ? request.tenantId() : null;
        List<Long> candidates = request != null ? request.candidateLeadIds() : null;
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                ScheduleResponse.from(sequencer.scheduleJobBroadcast(tenantId, jobId, candidates)));
    }

    private ControllerResponse planReminder(FullHttpRequest req, long jobId) {
        DayBeforeReminderRequest request = Controller.readBody(req, DayBeforeReminderRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        request.validate();

        ScheduleResult result = sequencer.scheduleDayBeforeReminder(request.tenantId(), jobId, request.phone(),
                request.name(), request.appointmentDate());
        return ControllerResponse.json(HttpResponseStatus.CREATED, ScheduleResponse.from(List.of(result)));
    }
}
