package crewdesk.workflow.api.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.api.v1.dto.RainDayCheckRequest;
import crewdesk.workflow.rainday.RainDayMonitor;
import crewdesk.workflow.rainday.RainDayRedistributor;
import crewdesk.workflow.rainday.RescheduleRequest;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Controller for weather rescheduling.
 * POST /api/v1/rain-day/reschedule - Move every job off a date
 * POST /api/v1/rain-day/check - Check the forecast and reschedule on a rain day
 */
public class RainDayController implements Controller {

    private static final String RESCHEDULE_PATH = "/api/v1/rain-day/reschedule";
    private static final String CHECK_PATH = "/api/v1/rain-day/check";

    private final RainDayRedistributor redistributor;
    private final RainDayMonitor monitor;

    public RainDayController(RainDayRedistributor redistributor, RainDayMonitor monitor) {
        this.redistributor = redistributor;
        this.monitor = monitor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (RESCHEDULE_PATH.equals(path) || CHECK_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (RESCHEDULE_PATH.equals(path)) {
            RescheduleRequest request = Controller.readBody(req, RescheduleRequest.class);
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return ControllerResponse.json(redistributor.reschedule(request));
        }

        RainDayCheckRequest request = Controller.readBody(req, RainDayCheckRequest.class);
        if (request == null) {
            request = new RainDayCheckRequest(null, null, null, null, null, null);
        }
        return ControllerResponse.json(
                monitor.checkAndHandle(request.zip(), request.resolvedDaysAhead(), request.options()));
    }
}
