package crewdesk.workflow.scheduler;

import crewdesk.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the periodic jobs of the workflow core:
 * - TaskWorker: drains due tasks (only with embedded polling enabled)
 * - TaskReaper: recovers tasks with expired leases
 * - Offer sweeper: expires unanswered crew offers (only with an offer timeout)
 * <p>
 * Uses a single-threaded executor so polls never overlap.
 */
public class BackgroundScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskWorker taskWorker;
    private final TaskReaper taskReaper;
    private final Runnable offerSweeper;
    private final WorkflowConfig config;

    private volatile boolean running = false;

    /**
     * @param taskWorker   polls due tasks
     * @param taskReaper   reclaims expired leases
     * @param offerSweeper expires stale crew offers
     * @param config       configuration
     */
    public BackgroundScheduler(TaskWorker taskWorker, TaskReaper taskReaper, Runnable offerSweeper,
            WorkflowConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crewdesk-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskWorker = taskWorker;
        this.taskReaper = taskReaper;
        this.offerSweeper = offerSweeper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Background scheduler already running");
            return;
        }

        running = true;

        if (config.embeddedPolling()) {
            long pollIntervalMs = config.pollInterval().toMillis();
            executor.scheduleWithFixedDelay(taskWorker, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
            log.info("Task worker scheduled every {}ms", pollIntervalMs);
        } else {
            log.info("Embedded polling disabled, tasks run via /internal/v1/tasks/process");
        }

        long reaperIntervalMs = config.taskReaperInterval().toMillis();
        executor.scheduleAtFixedRate(taskReaper, reaperIntervalMs, reaperIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", reaperIntervalMs);

        if (config.hasOfferTimeout()) {
            long sweepIntervalMs = config.offerSweepInterval().toMillis();
            executor.scheduleAtFixedRate(
                    wrapRunnable("offer-sweeper", offerSweeper),
                    sweepIntervalMs,
                    sweepIntervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("Offer sweeper scheduled every {}ms", sweepIntervalMs);
        }

        log.info("Background scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Background scheduler forcefully stopped");
            } else {
                log.info("Background scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
