package crewdesk.workflow;

import crewdesk.workflow.config.Dependencies;
import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.server.WorkflowHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Service entry point: HTTP API plus background task polling.
 * Configuration comes from CREWDESK_* environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        WorkflowConfig config = WorkflowConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        WorkflowHttpServer server = new WorkflowHttpServer(config, deps.routerHandler());
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "crewdesk-shutdown"));

        try {
            server.start();
            deps.startScheduler();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            server.stop();
            deps.close();
            System.exit(1);
        }

        log.info("Crewdesk workflow service started on port {}", server.port());
        shutdown.await();
    }
}
