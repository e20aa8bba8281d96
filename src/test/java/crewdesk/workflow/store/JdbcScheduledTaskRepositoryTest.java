package crewdesk.workflow.store;

import crewdesk.workflow.model.ScheduleResult;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskFailResult;
import crewdesk.workflow.model.TaskStatus;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduledTaskRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T15:00:00Z");

    private static Database db;
    private static JdbcScheduledTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(TestDatabase.url("task-repo") + ";LOCK_TIMEOUT=10000", 10);
        repo = new JdbcScheduledTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        TestDatabase.clean(db);
    }

    private static ScheduledTask task(String id, String dedupKey, Instant dueAt) {
        return ScheduledTask.builder()
                .id(id)
                .type(TaskType.LEAD_FOLLOW_UP)
                .dedupKey(dedupKey)
                .dueAt(dueAt)
                .payload("{\"leadId\":1}")
                .maxAttempts(3)
                .createdAt(NOW)
                .build();
    }

    @Test
    void insertAndFindById() {
        ScheduleResult result = repo.insert(task("t-1", "lead-1-stage-1", NOW));

        assertTrue(result.created());
        Optional<ScheduledTask> found = repo.findById("t-1");
        assertTrue(found.isPresent());
        assertEquals(TaskStatus.PENDING, found.get().status());
        assertEquals(0, found.get().attempts());
        assertEquals("lead-1-stage-1", found.get().dedupKey());
        assertEquals(NOW, found.get().dueAt());
    }

    @Test
    void liveDedupKeyReturnsExistingTask() {
        repo.insert(task("t-1", "lead-1-stage-1", NOW));

        ScheduleResult second = repo.insert(task("t-2", "lead-1-stage-1", NOW.plusSeconds(60)));

        assertFalse(second.created());
        assertEquals("t-1", second.taskId());
        assertTrue(repo.findById("t-2").isEmpty());
    }

    @Test
    void tasksWithoutDedupKeyNeverCollide() {
        assertTrue(repo.insert(task("t-1", null, NOW)).created());
        assertTrue(repo.insert(task("t-2", null, NOW)).created());
    }

    @Test
    void dedupKeyIsReusableOnceTaskIsTerminal() {
        repo.insert(task("t-1", "reminder-5-day-before", NOW));
        repo.claim("t-1", NOW);
        assertTrue(repo.complete("t-1", NOW));

        ScheduleResult again = repo.insert(task("t-2", "reminder-5-day-before", NOW));

        assertTrue(again.created());
        assertEquals("t-2", repo.findLiveByDedupKey("reminder-5-day-before").orElseThrow().id());
    }

    @Test
    void dedupKeyIsReusableAfterCancel() {
        repo.insert(task("t-1", "post-service-9", NOW));
        assertEquals(1, repo.cancelByDedupKey("post-service-9", NOW));

        assertTrue(repo.insert(task("t-2", "post-service-9", NOW)).created());
        assertEquals(TaskStatus.CANCELLED, repo.findById("t-1").orElseThrow().status());
    }

    @Test
    void findDueReturnsOnlyPendingDueTasksOldestFirst() {
        repo.insert(task("late", null, NOW.minusSeconds(10)));
        repo.insert(task("early", null, NOW.minusSeconds(600)));
        repo.insert(task("future", null, NOW.plusSeconds(600)));
        repo.insert(task("claimed", null, NOW.minusSeconds(900)));
        repo.claim("claimed", NOW);

        List<ScheduledTask> due = repo.findDue(NOW, 10);

        assertEquals(List.of("early", "late"), due.stream().map(ScheduledTask::id).toList());
        assertEquals(1, repo.findDue(NOW, 1).size());
    }

    @Test
    void claimIncrementsAttemptsAndRecordsLease() {
        repo.insert(task("t-1", null, NOW));

        Optional<ScheduledTask> claimed = repo.claim("t-1", NOW);

        assertTrue(claimed.isPresent());
        assertEquals(TaskStatus.PROCESSING, claimed.get().status());
        assertEquals(1, claimed.get().attempts());
        assertEquals(NOW, claimed.get().claimedAt());
        assertTrue(repo.claim("t-1", NOW).isEmpty(), "second claim must lose");
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        repo.insert(task("contended", null, NOW));

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                Callable<Boolean> claimer = () -> {
                    start.await();
                    try {
                        return repo.claim("contended", NOW).isPresent();
                    } catch (RuntimeException e) {
                        // a lock conflict also means this claimer lost
                        return false;
                    }
                };
                results.add(pool.submit(claimer));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(1, repo.findById("contended").orElseThrow().attempts());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failRetriesUntilAttemptsRunOut() {
        repo.insert(task("t-1", "lead-7-stage-2", NOW));

        for (int attempt = 1; attempt <= 2; attempt++) {
            repo.claim("t-1", NOW);
            assertEquals(TaskFailResult.RETRIED, repo.fail("t-1", "boom " + attempt, NOW, null));
            ScheduledTask task = repo.findById("t-1").orElseThrow();
            assertEquals(TaskStatus.PENDING, task.status());
            assertNull(task.claimedAt());
            assertEquals("boom " + attempt, task.lastError());
        }

        repo.claim("t-1", NOW);
        assertEquals(TaskFailResult.FAILED, repo.fail("t-1", "boom 3", NOW, null));

        ScheduledTask failed = repo.findById("t-1").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(3, failed.attempts());
        assertTrue(repo.claim("t-1", NOW).isEmpty());
        assertTrue(repo.findLiveByDedupKey("lead-7-stage-2").isEmpty());
    }

    @Test
    void failWithRetryTimePushesDueAt() {
        repo.insert(task("t-1", null, NOW));
        repo.claim("t-1", NOW);

        Instant retryAt = NOW.plus(Duration.ofMinutes(5));
        repo.fail("t-1", "later", NOW, retryAt);

        assertEquals(retryAt, repo.findById("t-1").orElseThrow().dueAt());
        assertTrue(repo.findDue(NOW, 10).isEmpty());
    }

    @Test
    void failOnSettledOrUnknownTaskIsBenign() {
        repo.insert(task("t-1", null, NOW));
        repo.claim("t-1", NOW);
        repo.complete("t-1", NOW);

        assertEquals(TaskFailResult.ALREADY_TERMINAL, repo.fail("t-1", "late failure", NOW, null));
        assertEquals(TaskFailResult.NOT_FOUND, repo.fail("missing", "x", NOW, null));
        assertEquals(TaskStatus.COMPLETED, repo.findById("t-1").orElseThrow().status());
    }

    @Test
    void completeRequiresProcessing() {
        repo.insert(task("t-1", null, NOW));

        assertFalse(repo.complete("t-1", NOW));
        repo.claim("t-1", NOW);
        assertTrue(repo.complete("t-1", NOW));
        assertFalse(repo.complete("t-1", NOW));
    }

    @Test
    void cancelLeavesClaimedTaskAlone() {
        repo.insert(task("t-1", "job-3-broadcast-urgent", NOW));
        repo.claim("t-1", NOW);

        assertEquals(0, repo.cancelByDedupKey("job-3-broadcast-urgent", NOW));
        assertEquals(TaskStatus.PROCESSING, repo.findById("t-1").orElseThrow().status());
    }

    @Test
    void leaseIsReleasedOnlyForTheObservedClaim() {
        repo.insert(task("t-1", null, NOW));
        Instant claimedAt = repo.claim("t-1", NOW).orElseThrow().claimedAt();

        assertEquals(1, repo.findExpiredLeases(NOW.plusSeconds(1)).size());
        assertFalse(repo.releaseLease("t-1", claimedAt.minusSeconds(1), "stale", NOW));
        assertTrue(repo.releaseLease("t-1", claimedAt, "lease expired", NOW));

        ScheduledTask released = repo.findById("t-1").orElseThrow();
        assertEquals(TaskStatus.PENDING, released.status());
        assertEquals(1, released.attempts());
    }

    @Test
    void countByStatusIncludesZeroes() {
        repo.insert(task("a", null, NOW));
        repo.insert(task("b", null, NOW));
        repo.claim("b", NOW);

        Map<TaskStatus, Integer> counts = repo.countByStatus();

        assertEquals(1, counts.get(TaskStatus.PENDING));
        assertEquals(1, counts.get(TaskStatus.PROCESSING));
        assertEquals(0, counts.get(TaskStatus.FAILED));
    }

    @Test
    void timestampsAreStoredAsUtcWallTimeWhateverTheJvmZone() throws Exception {
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("Asia/Tokyo"));
            repo.insert(task("t-1", "lead-1-stage-1", NOW));

            TimeZone.setDefault(TimeZone.getTimeZone("America/Los_Angeles"));
            assertEquals(NOW, repo.findById("t-1").orElseThrow().dueAt());
        } finally {
            TimeZone.setDefault(original);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT due_at FROM scheduled_tasks WHERE id = ?")) {
            ps.setString(1, "t-1");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(LocalDateTime.of(2025, 3, 10, 15, 0), rs.getObject("due_at", LocalDateTime.class));
            }
        }
    }
}
