package crewdesk.workflow.server;

import crewdesk.workflow.api.Controller;
import crewdesk.workflow.config.WorkflowConfig;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowHttpServerTest {

    private static WorkflowHttpServer server;
    private static HttpClient httpClient;

    /**
     * Reports whether the request is being handled on the channel's I/O thread.
     */
    static final class ThreadCheckController implements Controller {
        @Override
        public boolean matches(HttpMethod method, String path) {
            return HttpMethod.GET.equals(method) && path.equals("/api/v1/thread-check");
        }

        @Override
        public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
            boolean onIoThread = ctx.channel().eventLoop().inEventLoop();
            return ControllerResponse.json("{\"ioThread\":" + onIoThread + "}");
        }
    }

    @BeforeAll
    static void startServer() {
        WorkflowConfig config = WorkflowConfig.defaults().withServerPort(0);
        RouterHandler router = new RouterHandler(config).registerController(new ThreadCheckController());
        server = new WorkflowHttpServer(config, router);
        server.start();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterAll
    static void stopServer() {
        if (server != null)
            server.stop();
    }

    @Test
    void controllersRunOffTheIoThread() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder().uri(URI.create("http://localhost:" + server.port() + "/api/v1/thread-check"))
                        .GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("{\"ioThread\":false}", response.body());
    }

    @Test
    void startedServerReportsItsBoundPort() {
        assertTrue(server.isRunning());
        assertTrue(server.port() > 0);
    }
}
