package crewdesk.workflow.handler;

import crewdesk.workflow.config.Dependencies;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.model.ReminderType;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskStatus;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.rainday.ClearSkiesForecastProvider;
import crewdesk.workflow.scheduler.PollSummary;
import crewdesk.workflow.support.Fixtures;
import crewdesk.workflow.support.MutableClock;
import crewdesk.workflow.support.RecordingMessageSender;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Day-before, crew and post-service reminders run through the worker.
 */
class ReminderHandlersTest {

    private static final Instant START = Instant.parse("2025-03-10T15:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    private static MutableClock clock;
    private static RecordingMessageSender sender;
    private static Dependencies deps;

    @BeforeAll
    static void setup() {
        clock = new MutableClock(START);
        sender = new RecordingMessageSender();
        deps = Dependencies.create(TestDatabase.config("reminder-handlers"), clock, sender, sender,
                new ClearSkiesForecastProvider());
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDatabase.clean(deps.database());
        sender.clear();
        clock.set(START);
    }

    private PollSummary runAt(Instant when) {
        clock.set(when);
        return deps.taskWorker().pollOnce(50);
    }

    @Test
    void dayBeforeReminderTextsTheCustomer() {
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        deps.sequencer().scheduleDayBeforeReminder(null, job.id(), job.customerPhone(), "Parker", DAY);

        assertEquals(0, runAt(Instant.parse("2025-03-11T22:59:00Z")).processed());
        assertEquals(1, runAt(Instant.parse("2025-03-11T23:00:00Z")).succeeded());

        List<RecordingMessageSender.Sent> sent = sender.sentTo(job.customerPhone());
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).message().contains("is tomorrow, Wednesday, March 12"));
        assertTrue(deps.eventLog().forJob(job.id()).stream()
                .anyMatch(e -> e.type() == SystemEventType.REMINDER_SENT));
    }

    @Test
    void dayBeforeReminderSkipsCancelledJob() {
        Job job = deps.jobRepository().insert(Job.builder()
                .customerName("Gone")
                .customerPhone("+15559990000")
                .serviceDate(DAY)
                .status(JobStatus.CANCELLED)
                .build());
        deps.sequencer().scheduleDayBeforeReminder(null, job.id(), "+15559990000", "Gone", DAY);

        assertEquals(1, runAt(Instant.parse("2025-03-12T00:00:00Z")).succeeded());
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void movedJobIsRemindedForItsNewDateOnly() {
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        deps.sequencer().scheduleDayBeforeReminder(null, job.id(), job.customerPhone(), "Parker", DAY);
        deps.cascade().rescheduleJob(job.id(), LocalDate.of(2025, 3, 20));
        sender.clear();

        assertEquals(0, runAt(Instant.parse("2025-03-12T00:30:00Z")).processed());
        assertTrue(sender.sent().isEmpty());

        assertEquals(1, runAt(Instant.parse("2025-03-19T23:00:00Z")).succeeded());
        List<RecordingMessageSender.Sent> sent = sender.sentTo(job.customerPhone());
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).message().contains("is tomorrow, Thursday, March 20"));
    }

    @Test
    void reminderForAnOldDateIsSkipped() {
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        deps.sequencer().scheduleDayBeforeReminder(null, job.id(), job.customerPhone(), "Parker", DAY);
        deps.jobRepository().updateServiceDate(job.id(), LocalDate.of(2025, 3, 20), START);

        assertEquals(1, runAt(Instant.parse("2025-03-12T00:30:00Z")).succeeded());
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void failedReminderIsRetried() {
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        String taskId = deps.sequencer()
                .scheduleDayBeforeReminder(null, job.id(), job.customerPhone(), "Parker", DAY).taskId();
        sender.failFor(job.customerPhone());

        assertEquals(1, runAt(Instant.parse("2025-03-12T00:00:00Z")).failed());

        ScheduledTask task = deps.taskScheduler().findById(taskId).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(1, task.attempts());
    }

    @Test
    void crewReminderGoesToTheAssignedCleanerChat() {
        Cleaner ana = Fixtures.cleaner(deps.cleanerRepository(), "ana");
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        deps.jobRepository().markCleanerConfirmed(job.id(), ana.id(), START);
        Instant visit = Instant.parse("2025-03-12T16:00:00Z");
        deps.sequencer().scheduleJobReminder(job.id(), ana.id(), ReminderType.ONE_HOUR, visit);
        deps.sequencer().scheduleJobReminder(job.id(), ana.id(), ReminderType.JOB_START, visit);

        runAt(visit.minus(Duration.ofHours(1)));
        runAt(visit);

        List<RecordingMessageSender.Sent> toAna = sender.sentTo("chat-ana");
        assertEquals(2, toAna.size());
        assertEquals(Channel.CHAT, toAna.get(0).channel());
        assertTrue(toAna.get(0).message().startsWith("Reminder: you have a job in 1 hour"));
        assertTrue(toAna.get(1).message().endsWith("starts now. Have a great clean!"));
    }

    @Test
    void crewReminderSkipsReassignedJob() {
        Cleaner ana = Fixtures.cleaner(deps.cleanerRepository(), "ana");
        Cleaner bo = Fixtures.cleaner(deps.cleanerRepository(), "bo");
        Job job = Fixtures.job(deps.jobRepository(), DAY, "Parker");
        deps.jobRepository().markCleanerConfirmed(job.id(), bo.id(), START);
        Instant visit = Instant.parse("2025-03-12T16:00:00Z");
        deps.sequencer().scheduleJobReminder(job.id(), ana.id(), ReminderType.JOB_START, visit);

        assertEquals(1, runAt(visit).succeeded());
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void postServiceFollowUpThanksTheCustomer() {
        Instant completedAt = Instant.parse("2025-03-12T18:00:00Z");
        deps.sequencer().schedulePostServiceFollowUp(77L, "+15558887777", "Dana", completedAt);

        assertEquals(0, runAt(completedAt.plus(Duration.ofMinutes(119))).processed());
        assertEquals(1, runAt(completedAt.plus(Duration.ofHours(2))).succeeded());

        List<RecordingMessageSender.Sent> sent = sender.sentTo("+15558887777");
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).message().startsWith("Hi Dana! Thanks for choosing"));
        assertTrue(deps.eventLog().forJob(77L).stream()
                .anyMatch(e -> e.type() == SystemEventType.POST_SERVICE_FOLLOW_UP_SENT));
    }
}
