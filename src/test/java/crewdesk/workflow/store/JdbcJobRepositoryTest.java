package crewdesk.workflow.store;

import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.support.Fixtures;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T15:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    private static Database db;
    private static JdbcJobRepository jobs;

    @BeforeAll
    static void setup() {
        db = TestDatabase.open("job-repo");
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestDatabase.clean(db);
    }

    @Test
    void activeJobsAreOrderedByTimeWithUntimedLast() {
        Job untimed = jobs.insert(Job.builder().customerName("Untimed").serviceDate(DAY).build());
        Job afternoon = Fixtures.jobAt(jobs, DAY, LocalTime.of(14, 0), "Afternoon");
        Job morning = Fixtures.jobAt(jobs, DAY, LocalTime.of(8, 30), "Morning");
        jobs.insert(Job.builder().customerName("Cancelled").serviceDate(DAY).status(JobStatus.CANCELLED).build());

        List<Job> active = jobs.findActiveOnDate(DAY, null);

        assertEquals(List.of(morning.id(), afternoon.id(), untimed.id()), active.stream().map(Job::id).toList());
        assertEquals(3, jobs.countActiveOnDate(DAY, null));
    }

    @Test
    void tenantFilterNarrowsResults() {
        jobs.insert(Job.builder().tenantId("north").customerName("A").serviceDate(DAY).build());
        jobs.insert(Job.builder().tenantId("south").customerName("B").serviceDate(DAY).build());

        assertEquals(1, jobs.findActiveOnDate(DAY, "north").size());
        assertEquals(2, jobs.findActiveOnDate(DAY, null).size());
    }

    @Test
    void updateServiceDateMovesTheJob() {
        Job job = Fixtures.job(jobs, DAY, "Mover");

        assertTrue(jobs.updateServiceDate(job.id(), DAY.plusDays(2), NOW));
        assertFalse(jobs.updateServiceDate(999_999L, DAY.plusDays(2), NOW));

        assertEquals(DAY.plusDays(2), jobs.findById(job.id()).orElseThrow().serviceDate());
        assertEquals(0, jobs.countActiveOnDate(DAY, null));
    }

    @Test
    void confirmingACleanerSchedulesThePendingJob() {
        Job job = jobs.insert(Job.builder().customerName("Pending").serviceDate(DAY).status(JobStatus.PENDING).build());

        assertTrue(jobs.markCleanerConfirmed(job.id(), 42L, NOW));

        Job updated = jobs.findById(job.id()).orElseThrow();
        assertTrue(updated.cleanerConfirmed());
        assertEquals(42L, updated.cleanerId());
        assertEquals(JobStatus.SCHEDULED, updated.status());
        assertEquals(Set.of(42L), jobs.findConfirmedCleanerIdsOnDate(DAY));
    }
}
