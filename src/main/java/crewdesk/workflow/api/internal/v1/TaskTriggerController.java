package crewdesk.workflow.api.internal.v1;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.api.internal.v1.dto.ReapResponse;
import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.scheduler.PollSummary;
import crewdesk.workflow.scheduler.TaskReaper;
import crewdesk.workflow.scheduler.TaskWorker;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cron entry points for deployments without embedded polling.
 * POST /internal/v1/tasks/process?limit=N - Run one poll
 * POST /internal/v1/tasks/reap - Reclaim expired leases
 */
public class TaskTriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskTriggerController.class);

    private static final String PROCESS_PATH = "/internal/v1/tasks/process";
    private static final String REAP_PATH = "/internal/v1/tasks/reap";
    private static final int MAX_LIMIT = 500;

    private final TaskWorker worker;
    private final TaskReaper reaper;
    private final WorkflowConfig config;

    public TaskTriggerController(TaskWorker worker, TaskReaper reaper, WorkflowConfig config) {
        this.worker = worker;
        this.reaper = reaper;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (PROCESS_PATH.equals(path) || REAP_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (PROCESS_PATH.equals(path)) {
            int limit = Controller.queryInt(req, "limit", config.pollBatchSize());
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
            PollSummary summary = worker.pollOnce(limit);
            log.info("Triggered poll: {} processed, {} failed", summary.processed(), summary.failed());
            return ControllerResponse.json(summary);
        }

        return ControllerResponse.json(new ReapResponse(reaper.reapExpiredLeases()));
    }
}
