package crewdesk.workflow.store;

import crewdesk.workflow.model.AssignmentStatus;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.CleanerAssignment;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.support.Fixtures;
import crewdesk.workflow.support.TestDatabase;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAssignmentRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T15:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 12);

    private static Database db;
    private static JdbcAssignmentRepository assignments;
    private static JdbcJobRepository jobs;
    private static JdbcCleanerRepository cleaners;

    private Job job;
    private Cleaner ana;
    private Cleaner ben;

    @BeforeAll
    static void setup() {
        db = TestDatabase.open("assignment-repo");
        assignments = new JdbcAssignmentRepository(db);
        jobs = new JdbcJobRepository(db);
        cleaners = new JdbcCleanerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void seed() throws Exception {
        TestDatabase.clean(db);
        job = Fixtures.job(jobs, DAY, "Garcia");
        ana = Fixtures.cleaner(cleaners, "Ana");
        ben = Fixtures.cleaner(cleaners, "Ben");
    }

    @Test
    void onlyOneLiveAssignmentPerJob() {
        Optional<CleanerAssignment> first = assignments.createPending(job.id(), ana.id(), 2.5, NOW);
        Optional<CleanerAssignment> second = assignments.createPending(job.id(), ben.id(), 1.0, NOW);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(ana.id(), assignments.findLiveByJobId(job.id()).orElseThrow().cleanerId());
    }

    @Test
    void declineFreesTheJobForTheNextOffer() {
        long firstId = assignments.createPending(job.id(), ana.id(), null, NOW).orElseThrow().id();

        assertTrue(assignments.decline(firstId, NOW));
        assertTrue(assignments.findLiveByJobId(job.id()).isEmpty());
        assertTrue(assignments.createPending(job.id(), ben.id(), null, NOW).isPresent());

        assertEquals(Set.of(ana.id(), ben.id()), assignments.findContactedCleanerIds(job.id()));
    }

    @Test
    void confirmedAssignmentStaysLive() {
        long id = assignments.createPending(job.id(), ana.id(), null, NOW).orElseThrow().id();

        assertTrue(assignments.confirm(id, NOW));

        CleanerAssignment live = assignments.findLiveByJobId(job.id()).orElseThrow();
        assertEquals(AssignmentStatus.CONFIRMED, live.status());
        assertEquals(NOW, live.respondedAt());
        assertTrue(assignments.createPending(job.id(), ben.id(), null, NOW).isEmpty());
    }

    @Test
    void transitionsOnlyApplyToPendingOffers() {
        long id = assignments.createPending(job.id(), ana.id(), null, NOW).orElseThrow().id();
        assertTrue(assignments.decline(id, NOW));

        assertFalse(assignments.confirm(id, NOW));
        assertFalse(assignments.decline(id, NOW));
        assertEquals(AssignmentStatus.DECLINED, assignments.findById(id).orElseThrow().status());
    }

    @Test
    void findsStaleOffersByAssignmentTime() {
        assignments.createPending(job.id(), ana.id(), null, NOW.minusSeconds(3600));
        Job other = Fixtures.job(jobs, DAY, "Nguyen");
        assignments.createPending(other.id(), ben.id(), null, NOW);

        List<CleanerAssignment> stale = assignments.findPendingAssignedBefore(NOW.minusSeconds(60));

        assertEquals(1, stale.size());
        assertEquals(job.id(), stale.get(0).jobId());
    }
}
