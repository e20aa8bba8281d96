package crewdesk.workflow.cascade;

import crewdesk.workflow.config.Dependencies;
import crewdesk.workflow.followup.BroadcastPhase;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.model.Alert;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.model.AssignmentStatus;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.rainday.ClearSkiesForecastProvider;
import crewdesk.workflow.reschedule.RescheduleOutcome;
import crewdesk.workflow.support.Fixtures;
import crewdesk.workflow.support.MutableClock;
import crewdesk.workflow.support.RecordingMessageSender;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentCascadeTest {

    private static final String OWNER = "+15550001111";
    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    private static MutableClock clock;
    private static RecordingMessageSender sender;
    private static Dependencies deps;

    private AssignmentCascade cascade;

    @BeforeAll
    static void setup() {
        clock = MutableClock.at("2025-03-10T15:00:00Z");
        sender = new RecordingMessageSender();
        deps = Dependencies.create(TestDatabase.config("cascade").withOwnerPhone(OWNER), clock, sender, sender,
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
        clock.set(Instant.parse("2025-03-10T15:00:00Z"));
        cascade = deps.cascade();
    }

    private Job job(String customer) {
        return Fixtures.job(deps.jobRepository(), DAY, customer);
    }

    private Cleaner cleaner(String name) {
        return Fixtures.cleaner(deps.cleanerRepository(), name);
    }

    private List<SystemEventType> eventTypes(long jobId) {
        return deps.eventLog().forJob(jobId).stream().map(e -> e.type()).toList();
    }

    @Test
    void firstOfferGoesToFirstCleanerOnRoster() {
        Cleaner ana = cleaner("ana");
        cleaner("bo");
        Job job = job("Parker");

        OfferResult result = cascade.startAssignment(job.id());

        assertEquals(OfferResult.Status.OFFERED, result.status());
        assertEquals(ana.id(), result.cleanerId());
        List<RecordingMessageSender.Sent> offers = sender.sentTo("chat-ana");
        assertEquals(1, offers.size());
        assertEquals(Channel.CHAT, offers.get(0).channel());
        assertTrue(offers.get(0).message().startsWith("New job available!"));
        assertTrue(eventTypes(job.id()).contains(SystemEventType.CLEANER_OFFERED));
    }

    @Test
    void startingTwiceKeepsTheSinglePendingOffer() {
        cleaner("ana");
        cleaner("bo");
        Job job = job("Parker");

        OfferResult first = cascade.startAssignment(job.id());
        OfferResult second = cascade.startAssignment(job.id());

        assertEquals(OfferResult.Status.ALREADY_OFFERED, second.status());
        assertEquals(first.assignmentId(), second.assignmentId());
        assertEquals(1, cascade.assignmentStats(job.id()).totalAttempts());
        assertTrue(sender.sentTo("chat-bo").isEmpty());
    }

    @Test
    void acceptConfirmsJobAndTellsEveryone() {
        Cleaner ana = cleaner("ana");
        Job job = job("Parker");
        deps.sequencer().scheduleJobBroadcast(null, job.id(), List.of());
        OfferResult offer = cascade.startAssignment(job.id());

        ResponseResult result = cascade.onAccept(offer.assignmentId());

        assertEquals(ResponseResult.Status.ACCEPTED, result.status());
        Job confirmed = deps.jobRepository().findById(job.id()).orElseThrow();
        assertTrue(confirmed.cleanerConfirmed());
        assertEquals(ana.id(), confirmed.cleanerId());
        assertTrue(confirmed.customerNotified());

        List<RecordingMessageSender.Sent> toCustomer = sender.sentTo(job.customerPhone());
        assertEquals(1, toCustomer.size());
        assertTrue(toCustomer.get(0).message().contains("ana will be your cleaner"));
        assertEquals(2, sender.sentTo("chat-ana").size(), "offer and confirmation");

        for (BroadcastPhase phase : BroadcastPhase.values()) {
            assertTrue(deps.taskScheduler().findByDedupKey(FollowUpSequencer.broadcastKey(job.id(), phase))
                    .isEmpty(), phase + " should be cancelled");
        }
        assertEquals(OfferResult.Status.ALREADY_CONFIRMED, cascade.startAssignment(job.id()).status());
        assertTrue(eventTypes(job.id()).containsAll(
                List.of(SystemEventType.CLEANER_ACCEPTED, SystemEventType.CUSTOMER_NOTIFIED)));
    }

    @Test
    void declineOffersJobToNextCleaner() {
        cleaner("ana");
        Cleaner bo = cleaner("bo");
        Job job = job("Parker");
        OfferResult offer = cascade.startAssignment(job.id());

        ResponseResult result = cascade.onDecline(offer.assignmentId());

        assertEquals(ResponseResult.Status.DECLINED, result.status());
        assertEquals(OfferResult.Status.OFFERED, result.nextOffer().status());
        assertEquals(bo.id(), result.nextOffer().cleanerId());
        assertEquals(2, sender.sentTo("chat-ana").size(), "offer and acknowledgement");
        assertEquals(1, sender.sentTo("chat-bo").size());
    }

    @Test
    void exhaustingTheRosterEscalatesOnce() {
        Cleaner ana = cleaner("ana");
        Cleaner bo = cleaner("bo");
        Job job = job("Parker");

        OfferResult first = cascade.startAssignment(job.id());
        ResponseResult afterFirst = cascade.onDecline(first.assignmentId());
        ResponseResult afterSecond = cascade.onDecline(afterFirst.nextOffer().assignmentId());

        assertEquals(OfferResult.Status.EXHAUSTED, afterSecond.nextOffer().status());

        AssignmentStats stats = cascade.assignmentStats(job.id());
        assertEquals(2, stats.totalAttempts());
        assertEquals(2, stats.declined());
        assertEquals(List.of(ana.id(), bo.id()), stats.cleanersContacted());

        List<RecordingMessageSender.Sent> toOwner = sender.sentTo(OWNER);
        assertEquals(1, toOwner.size());
        assertTrue(toOwner.get(0).message().startsWith("URGENT: Job " + job.id()));
        assertTrue(sender.sentTo(job.customerPhone()).get(0).message().contains("sorry for the delay"));

        List<Alert> alerts = deps.alertService().unacknowledged(10);
        assertEquals(1, alerts.size());
        assertEquals(AlertType.CLEANERS_EXHAUSTED, alerts.get(0).type());
        assertEquals(2, alerts.get(0).thresholdValue());
        assertEquals(job.id(), alerts.get(0).jobId());
        assertTrue(eventTypes(job.id()).contains(SystemEventType.OWNER_ACTION_REQUIRED));
    }

    @Test
    void noCleanersAtAllEscalatesImmediately() {
        Job job = job("Parker");

        OfferResult result = cascade.startAssignment(job.id());

        assertEquals(OfferResult.Status.EXHAUSTED, result.status());
        assertEquals(1, sender.sentTo(OWNER).size());
    }

    @Test
    void repeatedExhaustionAlertsTheOwnerOnlyOnce() {
        Job job = job("Parker");

        cascade.startAssignment(job.id());
        OfferResult again = cascade.startAssignment(job.id());

        assertEquals(OfferResult.Status.EXHAUSTED, again.status());
        assertEquals(1, sender.sentTo(OWNER).size());
        assertEquals(1, sender.sentTo(job.customerPhone()).size());
        List<Alert> open = deps.alertService().unacknowledged(10);
        assertEquals(1, open.size());

        deps.alertService().acknowledge(open.get(0).id());
        cascade.startAssignment(job.id());

        assertEquals(2, sender.sentTo(OWNER).size());
    }

    @Test
    void exhaustionCancelsRemainingBroadcastPhases() {
        Job job = job("Parker");
        deps.sequencer().scheduleJobBroadcast(null, job.id(), List.of());

        cascade.startAssignment(job.id());

        for (BroadcastPhase phase : BroadcastPhase.values()) {
            assertTrue(deps.taskScheduler().findByDedupKey(FollowUpSequencer.broadcastKey(job.id(), phase)).isEmpty());
        }
    }

    @Test
    void acceptOnCancelledJobWithdrawsTheOffer() {
        cleaner("ana");
        Job job = job("Parker");
        long assignmentId = cascade.startAssignment(job.id()).assignmentId();
        sender.clear();
        Fixtures.setStatus(deps.database(), job.id(), JobStatus.CANCELLED);

        ResponseResult result = cascade.onAccept(assignmentId);

        assertEquals(ResponseResult.Status.ALREADY_SETTLED, result.status());
        assertEquals(AssignmentStatus.CANCELLED, result.assignmentStatus());
        Job stored = deps.jobRepository().findById(job.id()).orElseThrow();
        assertFalse(stored.cleanerConfirmed());
        assertNull(stored.cleanerId());
        assertTrue(sender.sent().isEmpty());
        assertTrue(deps.assignmentRepository().findLiveByJobId(job.id()).isEmpty());
        assertEquals(1, cascade.assignmentStats(job.id()).cancelled());
        assertEquals(ResponseResult.Status.ALREADY_SETTLED, cascade.onDecline(assignmentId).status());
    }

    @Test
    void concurrentAcceptAndDeclineSettleTheOfferOnce() throws Exception {
        for (int round = 0; round < 10; round++) {
            cleaner("ana" + round);
            Job job = job("Parker" + round);
            long assignmentId = cascade.startAssignment(job.id()).assignmentId();

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<ResponseResult> accept = pool.submit(() -> {
                    start.await();
                    return cascade.onAccept(assignmentId);
                });
                Future<ResponseResult> decline = pool.submit(() -> {
                    start.await();
                    return cascade.onDecline(assignmentId);
                });
                start.countDown();

                ResponseResult accepted = accept.get(10, TimeUnit.SECONDS);
                ResponseResult declined = decline.get(10, TimeUnit.SECONDS);
                boolean acceptWon = accepted.status() == ResponseResult.Status.ACCEPTED;
                boolean declineWon = declined.status() == ResponseResult.Status.DECLINED;
                assertTrue(acceptWon ^ declineWon, "exactly one response wins in round " + round);
                assertEquals(acceptWon ? AssignmentStatus.CONFIRMED : AssignmentStatus.DECLINED,
                        deps.assignmentRepository().findById(assignmentId).orElseThrow().status());
                assertEquals(acceptWon, deps.jobRepository().findById(job.id()).orElseThrow().cleanerConfirmed());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void lateResponsesAreReportedAsAlreadySettled() {
        cleaner("ana");
        Job job = job("Parker");
        long assignmentId = cascade.startAssignment(job.id()).assignmentId();
        cascade.onAccept(assignmentId);

        ResponseResult lateDecline = cascade.onDecline(assignmentId);
        ResponseResult secondAccept = cascade.onAccept(assignmentId);

        assertEquals(ResponseResult.Status.ALREADY_SETTLED, lateDecline.status());
        assertEquals(AssignmentStatus.CONFIRMED, lateDecline.assignmentStatus());
        assertEquals(ResponseResult.Status.ALREADY_SETTLED, secondAccept.status());
        assertEquals(1, sender.sentTo(job.customerPhone()).size());
    }

    @Test
    void unknownAssignmentIsNotFound() {
        assertEquals(ResponseResult.Status.NOT_FOUND, cascade.onAccept(987654L).status());
        assertEquals(ResponseResult.Status.NOT_FOUND, cascade.onDecline(987654L).status());
    }

    @Test
    void failedCustomerSmsDoesNotUndoTheAccept() {
        cleaner("ana");
        Job job = job("Parker");
        sender.failFor(job.customerPhone());
        long assignmentId = cascade.startAssignment(job.id()).assignmentId();

        ResponseResult result = cascade.onAccept(assignmentId);

        assertEquals(ResponseResult.Status.ACCEPTED, result.status());
        Job stored = deps.jobRepository().findById(job.id()).orElseThrow();
        assertTrue(stored.cleanerConfirmed());
        assertFalse(stored.customerNotified());
        assertTrue(eventTypes(job.id()).contains(SystemEventType.NOTIFICATION_FAILED));
    }

    @Test
    void cleanerConfirmedElsewhereThatDayIsSkipped() {
        cleaner("ana");
        Cleaner bo = cleaner("bo");
        Job morning = Fixtures.jobAt(deps.jobRepository(), DAY, LocalTime.of(8, 0), "Morning");
        cascade.onAccept(cascade.startAssignment(morning.id()).assignmentId());

        OfferResult second = cascade.startAssignment(job("Afternoon").id());

        assertEquals(bo.id(), second.cleanerId());
    }

    @Test
    void offerToNextCandidateHonoursExclusionsWithoutEscalating() {
        Cleaner ana = cleaner("ana");
        Job job = job("Parker");

        OfferResult result = cascade.offerToNextCandidate(job.id(), Set.of(ana.id()));

        assertEquals(OfferResult.Status.EXHAUSTED, result.status());
        assertTrue(sender.sentTo(OWNER).isEmpty());
    }

    @Test
    void closedOrMissingJobsAreNotAssignable() {
        cleaner("ana");
        Job cancelled = deps.jobRepository().insert(Job.builder()
                .customerName("Gone")
                .serviceDate(DAY)
                .status(JobStatus.CANCELLED)
                .build());

        assertEquals(OfferResult.Status.JOB_NOT_ASSIGNABLE, cascade.startAssignment(cancelled.id()).status());
        assertEquals(OfferResult.Status.JOB_NOT_ASSIGNABLE, cascade.startAssignment(555_555L).status());
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void staleOffersExpireAndMoveOn() {
        cleaner("ana");
        Cleaner bo = cleaner("bo");
        Job job = job("Parker");
        cascade.startAssignment(job.id());

        clock.advance(Duration.ofMinutes(30));
        assertEquals(0, cascade.expireStaleOffers(Duration.ofHours(1)));

        clock.advance(Duration.ofMinutes(31));
        assertEquals(1, cascade.expireStaleOffers(Duration.ofHours(1)));

        assertEquals(1, sender.sentTo("chat-ana").size(), "no acknowledgement for an expired offer");
        assertEquals(1, sender.sentTo("chat-bo").size());
        AssignmentStats stats = cascade.assignmentStats(job.id());
        assertEquals(1, stats.declined());
        assertEquals(1, stats.pending());
        assertEquals(bo.id(), stats.cleanersContacted().get(1));
        assertTrue(eventTypes(job.id()).contains(SystemEventType.OFFER_EXPIRED));
    }

    @Test
    void nudgeOnlyAppliesToPendingOffers() {
        cleaner("ana");
        Job job = job("Parker");
        assertFalse(cascade.nudgePendingOffer(job.id()));

        long assignmentId = cascade.startAssignment(job.id()).assignmentId();
        assertTrue(cascade.nudgePendingOffer(job.id()));
        assertTrue(sender.sentTo("chat-ana").get(1).message().startsWith("Still available?"));

        cascade.onAccept(assignmentId);
        assertFalse(cascade.nudgePendingOffer(job.id()));
    }

    @Test
    void rescheduleMovesJobAndNotifiesCustomer() {
        Job job = job("Parker");

        RescheduleOutcome outcome = cascade.rescheduleJob(job.id(), DAY.plusDays(2));

        assertTrue(outcome.success());
        assertEquals(1, outcome.notificationsSent());
        assertEquals(DAY.plusDays(2), deps.jobRepository().findById(job.id()).orElseThrow().serviceDate());
        assertFalse(cascade.rescheduleJob(777_777L, DAY).success());
        assertThrows(IllegalArgumentException.class, () -> cascade.rescheduleJob(job.id(), null));
    }
}
