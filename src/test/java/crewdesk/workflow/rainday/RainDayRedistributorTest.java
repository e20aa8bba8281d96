package crewdesk.workflow.rainday;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.events.AlertService;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.model.Alert;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.notify.NotificationService;
import crewdesk.workflow.notify.TemplateMessageComposer;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.reschedule.JobRescheduler;
import crewdesk.workflow.scheduler.TaskScheduler;
import crewdesk.workflow.store.Database;
import crewdesk.workflow.store.JdbcAlertRepository;
import crewdesk.workflow.store.JdbcCleanerRepository;
import crewdesk.workflow.store.JdbcJobRepository;
import crewdesk.workflow.store.JdbcScheduledTaskRepository;
import crewdesk.workflow.store.JdbcSystemEventRepository;
import crewdesk.workflow.support.Fixtures;
import crewdesk.workflow.support.MutableClock;
import crewdesk.workflow.support.RecordingMessageSender;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RainDayRedistributorTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    private static Database db;
    private static JdbcJobRepository jobs;

    private RecordingMessageSender sender;
    private AlertService alerts;
    private FailingJobRepository failing;
    private RainDayRedistributor redistributor;

    @BeforeAll
    static void setup() {
        db = TestDatabase.open("redistributor");
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDatabase.clean(db);
        MutableClock clock = MutableClock.at("2025-03-09T18:00:00Z");
        sender = new RecordingMessageSender();
        SystemEventLog events = new SystemEventLog(new JdbcSystemEventRepository(db), jobs, clock);
        alerts = new AlertService(new JdbcAlertRepository(db), clock);
        failing = new FailingJobRepository(jobs);
        JobRescheduler rescheduler = new JobRescheduler(failing, new JdbcCleanerRepository(db),
                new NotificationService(sender, events, WorkflowConfig.defaults()),
                new TemplateMessageComposer("Sparkle Co"), events, sequencer(clock), clock);
        redistributor = new RainDayRedistributor(failing, rescheduler, alerts);
    }

    private static FollowUpSequencer sequencer(MutableClock clock) {
        WorkflowConfig config = WorkflowConfig.defaults();
        return new FollowUpSequencer(new TaskScheduler(new JdbcScheduledTaskRepository(db), config, clock),
                config, clock);
    }

    private Job job(String customer, int hour) {
        return Fixtures.jobAt(jobs, MONDAY, LocalTime.of(hour, 0), customer);
    }

    private LocalDate dateOf(Job job) {
        return jobs.findById(job.id()).orElseThrow().serviceDate();
    }

    @Test
    void emptyWeekSpreadsOneJobPerDay() {
        Job a = job("Avery", 8);
        Job b = job("Blake", 10);
        Job c = job("Casey", 13);

        RescheduleResult result = redistributor.reschedule(RescheduleRequest.autoSpread(MONDAY));

        assertEquals(RescheduleResult.AUTO_SPREAD, result.targetDate());
        assertEquals(3, result.jobsAffected());
        assertEquals(3, result.jobsRescheduled());
        assertTrue(result.jobsFailed().isEmpty());
        assertEquals(3, result.notificationsSent());
        assertEquals(Map.of(LocalDate.of(2025, 3, 11), 1, LocalDate.of(2025, 3, 12), 1,
                LocalDate.of(2025, 3, 13), 1), result.spreadSummary());
        assertEquals(LocalDate.of(2025, 3, 11), dateOf(a));
        assertEquals(LocalDate.of(2025, 3, 12), dateOf(b));
        assertEquals(LocalDate.of(2025, 3, 13), dateOf(c));
        assertEquals(0, jobs.countActiveOnDate(MONDAY, null));
    }

    @Test
    void existingBookingsAreCountedBeforeSpreading() {
        Fixtures.job(jobs, LocalDate.of(2025, 3, 11), "Booked1");
        Fixtures.job(jobs, LocalDate.of(2025, 3, 11), "Booked2");
        Fixtures.job(jobs, LocalDate.of(2025, 3, 12), "Booked3");
        job("Avery", 8);
        job("Blake", 10);
        job("Casey", 13);

        RescheduleResult result = redistributor.reschedule(RescheduleRequest.autoSpread(MONDAY));

        assertEquals(Map.of(LocalDate.of(2025, 3, 13), 1, LocalDate.of(2025, 3, 14), 1,
                LocalDate.of(2025, 3, 15), 1), result.spreadSummary());
    }

    @Test
    void failedMoveIsReportedAndDoesNotConsumeCapacity() {
        Job a = job("Avery", 8);
        Job b = job("Blake", 10);
        Job c = job("Casey", 13);
        failing.failFor(a.id());

        RescheduleResult result = redistributor.reschedule(RescheduleRequest.autoSpread(MONDAY));

        assertEquals(3, result.jobsAffected());
        assertEquals(2, result.jobsRescheduled());
        assertEquals(List.of(a.id()), result.jobsFailed());
        assertEquals(MONDAY, dateOf(a));
        assertEquals(LocalDate.of(2025, 3, 11), dateOf(b));
        assertEquals(LocalDate.of(2025, 3, 12), dateOf(c));
        assertEquals(2, sender.sent().size());

        List<Alert> raised = alerts.unacknowledged(10);
        assertEquals(1, raised.size());
        assertEquals(AlertType.RAIN_DAY_RESCHEDULE, raised.get(0).type());
        assertEquals(3, raised.get(0).thresholdValue());
        assertEquals(2, raised.get(0).actualValue());
    }

    @Test
    void singleTargetMovesEverythingToOneDate() {
        job("Avery", 8);
        job("Blake", 10);
        LocalDate target = LocalDate.of(2025, 3, 20);

        RescheduleResult result = redistributor.reschedule(RescheduleRequest.toDate(MONDAY, target));

        assertEquals("2025-03-20", result.targetDate());
        assertEquals(2, result.jobsRescheduled());
        assertEquals(Map.of(target, 2), result.spreadSummary());
        assertEquals(2, jobs.countActiveOnDate(target, null));
    }

    @Test
    void notificationsCanBeSwitchedOff() {
        job("Avery", 8);

        RescheduleResult result = redistributor.reschedule(
                new RescheduleRequest(MONDAY, null, true, 7, false, null));

        assertEquals(1, result.jobsRescheduled());
        assertEquals(0, result.notificationsSent());
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void cancelledJobsStayWhereTheyAre() {
        Job cancelled = jobs.insert(Job.builder()
                .customerName("Gone")
                .serviceDate(MONDAY)
                .status(JobStatus.CANCELLED)
                .build());

        RescheduleResult result = redistributor.reschedule(RescheduleRequest.autoSpread(MONDAY));

        assertEquals(0, result.jobsAffected());
        assertTrue(result.spreadSummary().isEmpty());
        assertEquals(MONDAY, dateOf(cancelled));
        assertTrue(alerts.unacknowledged(10).isEmpty());
    }

    @Test
    void invalidRequestIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> redistributor.reschedule(RescheduleRequest.toDate(MONDAY, MONDAY)));
    }

    /**
     * Delegates to the real store but refuses to move chosen jobs.
     */
    private static final class FailingJobRepository implements JobRepository {

        private final JobRepository delegate;
        private final Set<Long> failing = new HashSet<>();

        FailingJobRepository(JobRepository delegate) {
            this.delegate = delegate;
        }

        void failFor(long jobId) {
            failing.add(jobId);
        }

        @Override
        public Job insert(Job job) {
            return delegate.insert(job);
        }

        @Override
        public Optional<Job> findById(long jobId) {
            return delegate.findById(jobId);
        }

        @Override
        public List<Job> findActiveOnDate(LocalDate date, String tenantId) {
            return delegate.findActiveOnDate(date, tenantId);
        }

        @Override
        public int countActiveOnDate(LocalDate date, String tenantId) {
            return delegate.countActiveOnDate(date, tenantId);
        }

        @Override
        public Set<Long> findConfirmedCleanerIdsOnDate(LocalDate date) {
            return delegate.findConfirmedCleanerIdsOnDate(date);
        }

        @Override
        public boolean updateServiceDate(long jobId, LocalDate newDate, Instant now) {
            if (failing.contains(jobId)) {
                throw new RuntimeException("Failed to update job: " + jobId);
            }
            return delegate.updateServiceDate(jobId, newDate, now);
        }

        @Override
        public boolean markCleanerConfirmed(long jobId, long cleanerId, Instant now) {
            return delegate.markCleanerConfirmed(jobId, cleanerId, now);
        }

        @Override
        public boolean markCustomerNotified(long jobId, Instant now) {
            return delegate.markCustomerNotified(jobId, now);
        }
    }
}
