package crewdesk.workflow.api.internal.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.cascade.AssignmentCascade;
import crewdesk.workflow.cascade.ResponseResult;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Crew replies to offers, posted by the messaging webhook (internal API).
 * POST /internal/v1/assignments/{id}/accept
 * POST /internal/v1/assignments/{id}/decline
 * <p>
 * Both are idempotent: answering a settled offer returns 200 with ALREADY_SETTLED.
 */
public class AssignmentResponseController implements Controller {

    private static final Pattern RESPONSE_PATTERN =
            Pattern.compile("^/internal/v1/assignments/([^/]+)/(accept|decline)$");

    private final AssignmentCascade cascade;

    public AssignmentResponseController(AssignmentCascade cascade) {
        this.cascade = cascade;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && RESPONSE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = RESPONSE_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown assignment endpoint");
        }

        long assignmentId = Controller.pathId(matcher.group(1), "assignmentId");
        ResponseResult result = "accept".equals(matcher.group(2))
                ? cascade.onAccept(assignmentId)
                : cascade.onDecline(assignmentId);

        if (result.status() == ResponseResult.Status.NOT_FOUND) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, result);
        }
        return ControllerResponse.json(result);
    }
}
