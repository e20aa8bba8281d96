package crewdesk.workflow.api.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.cascade.AssignmentCascade;
import crewdesk.workflow.cascade.OfferResult;
import crewdesk.workflow.repository.JobRepository;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for staffing a job.
 * POST /api/v1/jobs/{jobId}/assignment - Start (or resume) the offer cascade
 * GET  /api/v1/jobs/{jobId}/assignments/stats - Offer history
 */
public class AssignmentController implements Controller {

    private static final Pattern START_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/assignment$");
    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/assignments/stats$");

    private final AssignmentCascade cascade;
    private final JobRepository jobs;

    public AssignmentController(AssignmentCascade cascade, JobRepository jobs) {
        this.cascade = cascade;
        this.jobs = jobs;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && START_PATTERN.matcher(path).matches())
                || (method.equals(HttpMethod.GET) && STATS_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher start = START_PATTERN.matcher(path);
        if (start.matches()) {
            long jobId = Controller.pathId(start.group(1), "jobId");
            if (jobs.findById(jobId).isEmpty()) {
                return ControllerResponse.notFound("job not found");
            }
            OfferResult result = cascade.startAssignment(jobId);
            return switch (result.status()) {
                case OFFERED -> ControllerResponse.json(HttpResponseStatus.CREATED, result);
                case JOB_NOT_ASSIGNABLE -> ControllerResponse.json(HttpResponseStatus.CONFLICT, result);
                case ALREADY_OFFERED, ALREADY_CONFIRMED, EXHAUSTED -> ControllerResponse.json(result);
            };
        }

        Matcher stats = STATS_PATTERN.matcher(path);
        if (stats.matches()) {
            long jobId = Controller.pathId(stats.group(1), "jobId");
            if (jobs.findById(jobId).isEmpty()) {
                return ControllerResponse.notFound("job not found");
            }
            return ControllerResponse.json(cascade.assignmentStats(jobId));
        }

        return ControllerResponse.notFound("unknown assignment endpoint");
    }
}
