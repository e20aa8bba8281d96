package crewdesk.workflow.server;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.api.Controller.ControllerResponse;
import crewdesk.workflow.config.WorkflowConfig;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (cron and webhook API, bearer token when a cron secret is set)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final List<Controller> controllers = new ArrayList<>();
    private final WorkflowConfig config;

    public RouterHandler(WorkflowConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, UNAUTHORIZED, "application/json", "{\"error\":\"unauthorized\"}", keepAlive);
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    write(ctx, response.status(), response.contentType(), response.body(), keepAlive);
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}", keepAlive);

        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            write(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + ControllerResponse.escapeJson(e.getMessage()) + "\"}", keepAlive);
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            write(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"internal error\"}", keepAlive);
        }
    }

    /**
     * Internal endpoints need {@code Authorization: Bearer <cronSecret>} once a secret is configured.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasCronSecret() || !path.startsWith("/internal/")) {
            return true;
        }

        String header = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] provided = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        byte[] expected = config.cronSecret().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(provided, expected);
    }

    private void write(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body,
            boolean keepAlive) {
        byte[] bytes = (body != null ? body : "").getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        HttpUtil.setKeepAlive(response, keepAlive);
        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
