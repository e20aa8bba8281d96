package crewdesk.workflow.api.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.events.AlertService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for operator alerts.
 * GET  /api/v1/alerts?limit=N - Unacknowledged alerts, newest first
 * POST /api/v1/alerts/{id}/acknowledge
 */
public class AlertController implements Controller {

    private static final String LIST_PATH = "/api/v1/alerts";
    private static final Pattern ACK_PATTERN = Pattern.compile("^/api/v1/alerts/([^/]+)/acknowledge$");
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final AlertService alerts;

    public AlertController(AlertService alerts) {
        this.alerts = alerts;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && LIST_PATH.equals(path))
                || (method.equals(HttpMethod.POST) && ACK_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (LIST_PATH.equals(path)) {
            int limit = Controller.queryInt(req, "limit", DEFAULT_LIMIT);
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
            return ControllerResponse.json(alerts.unacknowledged(limit));
        }

        Matcher ack = ACK_PATTERN.matcher(path);
        if (ack.matches()) {
            long alertId = Controller.pathId(ack.group(1), "alertId");
            if (alerts.findById(alertId).isEmpty()) {
                return ControllerResponse.notFound("alert not found");
            }
            boolean changed = alerts.acknowledge(alertId);
            return ControllerResponse.json(Map.of("acknowledged", true, "changed", changed));
        }

        return ControllerResponse.notFound("unknown alert endpoint");
    }
}
