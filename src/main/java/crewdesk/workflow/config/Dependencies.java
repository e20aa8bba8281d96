package crewdesk.workflow.config;

import crewdesk.workflow.api.internal.v1.AssignmentResponseController;
import crewdesk.workflow.api.internal.v1.TaskTriggerController;
import crewdesk.workflow.api.v1.AlertController;
import crewdesk.workflow.api.v1.AssignmentController;
import crewdesk.workflow.api.v1.FollowUpController;
import crewdesk.workflow.api.v1.HealthController;
import crewdesk.workflow.api.v1.RainDayController;
import crewdesk.workflow.cascade.AssignmentCascade;
import crewdesk.workflow.cascade.DistanceRankedEligibilityResolver;
import crewdesk.workflow.cascade.OfferTimeoutSweeper;
import crewdesk.workflow.events.AlertService;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.handler.DayBeforeReminderHandler;
import crewdesk.workflow.handler.JobBroadcastHandler;
import crewdesk.workflow.handler.JobReminderHandler;
import crewdesk.workflow.handler.LeadFollowUpHandler;
import crewdesk.workflow.handler.PostServiceFollowUpHandler;
import crewdesk.workflow.notify.LoggingMessageSender;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.NotificationService;
import crewdesk.workflow.notify.OutboundCaller;
import crewdesk.workflow.notify.TemplateMessageComposer;
import crewdesk.workflow.rainday.ClearSkiesForecastProvider;
import crewdesk.workflow.rainday.ForecastProvider;
import crewdesk.workflow.rainday.RainDayMonitor;
import crewdesk.workflow.rainday.RainDayRedistributor;
import crewdesk.workflow.repository.AlertRepository;
import crewdesk.workflow.repository.AssignmentRepository;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.repository.ScheduledTaskRepository;
import crewdesk.workflow.repository.SystemEventRepository;
import crewdesk.workflow.reschedule.JobRescheduler;
import crewdesk.workflow.scheduler.BackgroundScheduler;
import crewdesk.workflow.scheduler.TaskDispatcher;
import crewdesk.workflow.scheduler.TaskReaper;
import crewdesk.workflow.scheduler.TaskScheduler;
import crewdesk.workflow.scheduler.TaskWorker;
import crewdesk.workflow.server.RouterHandler;
import crewdesk.workflow.store.Database;
import crewdesk.workflow.store.JdbcAlertRepository;
import crewdesk.workflow.store.JdbcAssignmentRepository;
import crewdesk.workflow.store.JdbcCleanerRepository;
import crewdesk.workflow.store.JdbcJobRepository;
import crewdesk.workflow.store.JdbcScheduledTaskRepository;
import crewdesk.workflow.store.JdbcSystemEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(WorkflowConfig.fromEnv());
 * deps.startScheduler(); // start background polling
 * deps.cascade().startAssignment(jobId);
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkflowConfig config;
    private final Database database;

    private final ScheduledTaskRepository taskRepository;
    private final JobRepository jobRepository;
    private final CleanerRepository cleanerRepository;
    private final AssignmentRepository assignmentRepository;

    private final SystemEventLog eventLog;
    private final AlertService alertService;
    private final TaskScheduler taskScheduler;
    private final FollowUpSequencer sequencer;
    private final JobRescheduler rescheduler;
    private final AssignmentCascade cascade;
    private final RainDayRedistributor redistributor;
    private final RainDayMonitor rainDayMonitor;
    private final TaskWorker taskWorker;
    private final TaskReaper taskReaper;
    private final OfferTimeoutSweeper offerSweeper;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private BackgroundScheduler backgroundScheduler;

    private Dependencies(WorkflowConfig config, Clock clock, MessageSender sender, OutboundCaller caller,
            ForecastProvider forecasts) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcScheduledTaskRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.cleanerRepository = new JdbcCleanerRepository(database);
        this.assignmentRepository = new JdbcAssignmentRepository(database);
        AlertRepository alertRepository = new JdbcAlertRepository(database);
        SystemEventRepository eventRepository = new JdbcSystemEventRepository(database);

        // Services
        this.eventLog = new SystemEventLog(eventRepository, jobRepository, clock);
        this.alertService = new AlertService(alertRepository, clock);
        MessageComposer composer = new TemplateMessageComposer(config.businessName());
        NotificationService notifications = new NotificationService(sender, eventLog, config);

        this.taskScheduler = new TaskScheduler(taskRepository, config, clock);
        this.sequencer = new FollowUpSequencer(taskScheduler, config, clock);
        this.rescheduler = new JobRescheduler(jobRepository, cleanerRepository, notifications, composer,
                eventLog, sequencer, clock);
        this.cascade = new AssignmentCascade(jobRepository, cleanerRepository, assignmentRepository,
                new DistanceRankedEligibilityResolver(cleanerRepository, jobRepository),
                notifications, composer, eventLog, alertService, rescheduler, sequencer, clock);
        this.redistributor = new RainDayRedistributor(jobRepository, rescheduler, alertService);
        this.rainDayMonitor = new RainDayMonitor(forecasts, redistributor, notifications, composer, config, clock);

        // Task execution
        TaskDispatcher dispatcher = new TaskDispatcher(List.of(
                new LeadFollowUpHandler(sender, caller, composer, eventLog, config),
                new JobBroadcastHandler(jobRepository, cascade, notifications, composer, eventLog),
                new DayBeforeReminderHandler(jobRepository, sender, composer, eventLog),
                new JobReminderHandler(jobRepository, cleanerRepository, sender, composer, eventLog),
                new PostServiceFollowUpHandler(sender, composer, eventLog)));
        this.taskWorker = new TaskWorker(taskScheduler, dispatcher, alertService, eventLog, config.pollBatchSize());
        this.taskReaper = new TaskReaper(taskRepository, config, clock);
        this.offerSweeper = new OfferTimeoutSweeper(cascade, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config. Messages and calls are only
     * logged and every forecast is dry until real providers are plugged in.
     */
    public static Dependencies create(WorkflowConfig config) {
        LoggingMessageSender logging = new LoggingMessageSender();
        return create(config, Clock.systemUTC(), logging, logging, new ClearSkiesForecastProvider());
    }

    public static Dependencies create(WorkflowConfig config, Clock clock, MessageSender sender,
            OutboundCaller caller, ForecastProvider forecasts) {
        return new Dependencies(config, clock, sender, caller, forecasts);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(WorkflowConfig.fromEnv());
    }

    public WorkflowConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ScheduledTaskRepository taskRepository() {
        return taskRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public CleanerRepository cleanerRepository() {
        return cleanerRepository;
    }

    public AssignmentRepository assignmentRepository() {
        return assignmentRepository;
    }

    public SystemEventLog eventLog() {
        return eventLog;
    }

    public AlertService alertService() {
        return alertService;
    }

    public TaskScheduler taskScheduler() {
        return taskScheduler;
    }

    public FollowUpSequencer sequencer() {
        return sequencer;
    }

    public AssignmentCascade cascade() {
        return cascade;
    }

    public RainDayRedistributor redistributor() {
        return redistributor;
    }

    public RainDayMonitor rainDayMonitor() {
        return rainDayMonitor;
    }

    public TaskWorker taskWorker() {
        return taskWorker;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, taskScheduler))
                    .registerController(new FollowUpController(sequencer))
                    .registerController(new AssignmentController(cascade, jobRepository))
                    .registerController(new RainDayController(redistributor, rainDayMonitor))
                    .registerController(new AlertController(alertService))
                    .registerController(new TaskTriggerController(taskWorker, taskReaper, config))
                    .registerController(new AssignmentResponseController(cascade));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the background scheduler (creates it if not yet created).
     */
    public synchronized BackgroundScheduler backgroundScheduler() {
        if (backgroundScheduler == null) {
            backgroundScheduler = new BackgroundScheduler(taskWorker, taskReaper, offerSweeper, config);
        }
        return backgroundScheduler;
    }

    /**
     * Start background polling, lease reaping and offer expiry.
     * Should be called after server startup.
     */
    public void startScheduler() {
        backgroundScheduler().start();
    }

    public synchronized void stopScheduler() {
        if (backgroundScheduler != null) {
            backgroundScheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        stopScheduler();
        database.close();
        log.info("Dependencies closed");
    }
}
