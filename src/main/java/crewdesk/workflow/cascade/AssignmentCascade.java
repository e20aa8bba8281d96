package crewdesk.workflow.cascade;

import crewdesk.workflow.events.AlertService;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.model.AssignmentStatus;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.CleanerAssignment;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.NotificationService;
import crewdesk.workflow.repository.AssignmentRepository;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.reschedule.JobRescheduler;
import crewdesk.workflow.reschedule.RescheduleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Offers a job to one crew member at a time until someone accepts.
 * <p>
 * State per job: unassigned, offered to one candidate, then confirmed or
 * declined. A decline offers the job to the next candidate; when nobody is
 * left the owner is escalated to and the cascade stops.
 * <p>
 * Every transition is a conditional update in the store. Notifications are
 * sent after the transition commits and never undo it.
 */
public class AssignmentCascade {

    private static final Logger log = LoggerFactory.getLogger(AssignmentCascade.class);
    private static final String SOURCE = "assignment-cascade";

    private final JobRepository jobs;
    private final CleanerRepository cleaners;
    private final AssignmentRepository assignments;
    private final EligibilityResolver resolver;
    private final NotificationService notifications;
    private final MessageComposer composer;
    private final SystemEventLog events;
    private final AlertService alerts;
    private final JobRescheduler rescheduler;
    private final FollowUpSequencer sequencer;
    private final Clock clock;

    public AssignmentCascade(JobRepository jobs,
                             CleanerRepository cleaners,
                             AssignmentRepository assignments,
                             EligibilityResolver resolver,
                             NotificationService notifications,
                             MessageComposer composer,
                             SystemEventLog events,
                             AlertService alerts,
                             JobRescheduler rescheduler,
                             FollowUpSequencer sequencer,
                             Clock clock) {
        this.jobs = jobs;
        this.cleaners = cleaners;
        this.assignments = assignments;
        this.resolver = resolver;
        this.notifications = notifications;
        this.composer = composer;
        this.events = events;
        this.alerts = alerts;
        this.rescheduler = rescheduler;
        this.sequencer = sequencer;
        this.clock = clock;
    }

    /**
     * Start (or resume) staffing a job.
     * Crew members contacted earlier for this job are not asked again.
     */
    public OfferResult startAssignment(long jobId) {
        Optional<Job> job = jobs.findById(jobId);
        if (job.isEmpty()) {
            return OfferResult.notAssignable("job not found: " + jobId);
        }
        if (!job.get().status().isAssignable()) {
            return OfferResult.notAssignable("job " + jobId + " is " + job.get().status());
        }

        Optional<OfferResult> live = liveAssignmentResult(jobId);
        if (live.isPresent()) {
            return live.get();
        }

        OfferResult result = offer(job.get(), assignments.findContactedCleanerIds(jobId));
        if (result.status() == OfferResult.Status.EXHAUSTED) {
            escalate(job.get());
        }
        return result;
    }

    /**
     * Offer the job to the best candidate not in {@code excludedCleanerIds}.
     * Does not escalate on exhaustion; that is the caller's decision.
     */
    public OfferResult offerToNextCandidate(long jobId, Set<Long> excludedCleanerIds) {
        Optional<Job> job = jobs.findById(jobId);
        if (job.isEmpty()) {
            return OfferResult.notAssignable("job not found: " + jobId);
        }
        if (!job.get().status().isAssignable()) {
            return OfferResult.notAssignable("job " + jobId + " is " + job.get().status());
        }
        return offer(job.get(), excludedCleanerIds != null ? excludedCleanerIds : Set.of());
    }

    private OfferResult offer(Job job, Set<Long> excluded) {
        Optional<Candidate> candidate = resolver.nextCandidate(job, excluded);
        if (candidate.isEmpty()) {
            log.info("No eligible cleaners left for job {} ({} excluded)", job.id(), excluded.size());
            return OfferResult.exhausted();
        }

        Cleaner cleaner = candidate.get().cleaner();
        Optional<CleanerAssignment> created = assignments.createPending(job.id(), cleaner.id(),
                candidate.get().distanceMiles(), clock.instant());
        if (created.isEmpty()) {
            // Lost to a concurrent offer or accept
            return liveAssignmentResult(job.id())
                    .orElseGet(() -> OfferResult.alreadyOffered(null, null));
        }

        CleanerAssignment assignment = created.get();
        notifications.chatCleaner(cleaner, composer.cleanerOffer(job), job.id());
        events.record(job.tenantId(), SystemEventType.CLEANER_OFFERED, SOURCE,
                "Job offered to " + cleaner.name(), job.id(), cleaner.id(), cleaner.phone(),
                distanceMetadata(assignment));

        log.info("Job {} offered to cleaner {} (assignment {})", job.id(), cleaner.id(), assignment.id());
        return OfferResult.offered(assignment.id(), cleaner.id());
    }

    private Optional<OfferResult> liveAssignmentResult(long jobId) {
        return assignments.findLiveByJobId(jobId).map(a -> a.status() == AssignmentStatus.CONFIRMED
                ? OfferResult.alreadyConfirmed(a.id(), a.cleanerId())
                : OfferResult.alreadyOffered(a.id(), a.cleanerId()));
    }

    private static Map<String, ?> distanceMetadata(CleanerAssignment assignment) {
        return assignment.distanceMiles() != null
                ? Map.of("assignmentId", assignment.id(), "distanceMiles", assignment.distanceMiles())
                : Map.of("assignmentId", assignment.id());
    }

    /**
     * A crew member accepted an offer.
     */
    public ResponseResult onAccept(long assignmentId) {
        Optional<CleanerAssignment> existing = assignments.findById(assignmentId);
        if (existing.isEmpty()) {
            return ResponseResult.notFound(assignmentId);
        }

        Instant now = clock.instant();
        CleanerAssignment assignment = existing.get();
        long jobId = assignment.jobId();

        Optional<Job> target = jobs.findById(jobId);
        if (target.isEmpty() || !target.get().status().isAssignable()) {
            return cancelOffer(assignment, target.map(j -> j.status().name()).orElse("missing"), now);
        }

        if (!assignments.confirm(assignmentId, now)) {
            AssignmentStatus current = currentStatus(assignment);
            log.warn("Accept ignored for assignment {}: already {}", assignmentId, current);
            return ResponseResult.alreadySettled(assignmentId, current);
        }

        jobs.markCleanerConfirmed(jobId, assignment.cleanerId(), now);
        log.info("Cleaner {} confirmed for job {}", assignment.cleanerId(), jobId);

        Optional<Job> job = jobs.findById(jobId);
        Optional<Cleaner> cleaner = cleaners.findById(assignment.cleanerId());
        if (job.isPresent() && cleaner.isPresent()) {
            notifyAccepted(job.get(), cleaner.get());
        }

        int cancelled = sequencer.cancelJobBroadcast(jobId);
        if (cancelled > 0) {
            log.debug("Cancelled {} pending broadcast phase(s) for job {}", cancelled, jobId);
        }

        events.record(target.get().tenantId(), SystemEventType.CLEANER_ACCEPTED, SOURCE,
                "Cleaner accepted the job", jobId, assignment.cleanerId());
        return ResponseResult.accepted(assignmentId);
    }

    /**
     * Withdraw an offer whose job was closed while it was pending. Nobody is notified.
     */
    private ResponseResult cancelOffer(CleanerAssignment assignment, String jobState, Instant now) {
        if (!assignments.cancel(assignment.id(), now)) {
            AssignmentStatus current = currentStatus(assignment);
            log.warn("Accept ignored for assignment {}: already {}", assignment.id(), current);
            return ResponseResult.alreadySettled(assignment.id(), current);
        }
        log.info("Assignment {} cancelled on accept: job {} is {}", assignment.id(), assignment.jobId(), jobState);
        return ResponseResult.alreadySettled(assignment.id(), AssignmentStatus.CANCELLED);
    }

    private AssignmentStatus currentStatus(CleanerAssignment assignment) {
        return assignments.findById(assignment.id())
                .map(CleanerAssignment::status)
                .orElse(assignment.status());
    }

    private void notifyAccepted(Job job, Cleaner cleaner) {
        if (job.hasCustomerPhone()
                && notifications.smsCustomer(job.customerPhone(), composer.cleanerAssigned(job, cleaner), job.id())) {
            jobs.markCustomerNotified(job.id(), clock.instant());
            events.record(job.tenantId(), SystemEventType.CUSTOMER_NOTIFIED, SOURCE, "Customer told who is coming",
                    job.id(), cleaner.id(), job.customerPhone(), Map.of());
        }
        notifications.chatCleaner(cleaner, composer.assignmentConfirmed(job), job.id());
    }

    /**
     * A crew member declined an offer. The job moves on to the next candidate.
     */
    public ResponseResult onDecline(long assignmentId) {
        return handleDeclined(assignmentId, SystemEventType.CLEANER_DECLINED, true);
    }

    private ResponseResult handleDeclined(long assignmentId, SystemEventType eventType, boolean acknowledge) {
        Optional<CleanerAssignment> existing = assignments.findById(assignmentId);
        if (existing.isEmpty()) {
            return ResponseResult.notFound(assignmentId);
        }

        if (!assignments.decline(assignmentId, clock.instant())) {
            AssignmentStatus current = currentStatus(existing.get());
            log.warn("Decline ignored for assignment {}: already {}", assignmentId, current);
            return ResponseResult.alreadySettled(assignmentId, current);
        }

        CleanerAssignment assignment = existing.get();
        long jobId = assignment.jobId();
        Optional<Job> job = jobs.findById(jobId);
        Optional<Cleaner> cleaner = cleaners.findById(assignment.cleanerId());

        if (acknowledge && job.isPresent() && cleaner.isPresent()) {
            notifications.chatCleaner(cleaner.get(), composer.declineAcknowledged(job.get()), jobId);
        }
        events.record(job.map(Job::tenantId).orElse(null), eventType, SOURCE,
                eventType == SystemEventType.OFFER_EXPIRED ? "Offer expired without an answer" : "Cleaner declined",
                jobId, assignment.cleanerId());
        log.info("Assignment {} for job {} {}", assignmentId, jobId,
                eventType == SystemEventType.OFFER_EXPIRED ? "expired" : "declined");

        OfferResult next = offerToNextCandidate(jobId, assignments.findContactedCleanerIds(jobId));
        if (next.status() == OfferResult.Status.EXHAUSTED && job.isPresent()) {
            escalate(job.get());
        }
        return ResponseResult.declined(assignmentId, next);
    }

    /**
     * Tell the customer and the owner that nobody took the job. Happens once
     * per job while the owner has not acknowledged the alert; the remaining
     * broadcast phases are cancelled.
     */
    private void escalate(Job job) {
        int contacted = assignments.findContactedCleanerIds(job.id()).size();
        if (alerts.hasOpenAlert(AlertType.CLEANERS_EXHAUSTED, job.id())) {
            log.info("Job {} still has no cleaner; owner already alerted", job.id());
            events.record(job.tenantId(), SystemEventType.OWNER_ACTION_REQUIRED, SOURCE,
                    "Still no cleaner, owner already alerted", job.id(), null, null, Map.of("cleanersContacted", contacted, "repeat", true));
            return;
        }

        log.warn("Job {} exhausted all {} contacted cleaner(s), escalating to owner", job.id(), contacted);

        if (job.hasCustomerPhone()) {
            notifications.smsCustomer(job.customerPhone(), composer.assignmentDelayed(job), job.id());
        }
        notifications.smsOwner(composer.ownerEscalation(job, contacted), job.id());
        alerts.raise(AlertType.CLEANERS_EXHAUSTED, job.id(), contacted, 0,
                "No cleaner accepted job " + job.id() + " after " + contacted + " offer(s)");
        events.record(job.tenantId(), SystemEventType.OWNER_ACTION_REQUIRED, SOURCE, "Manual assignment needed",
                job.id(), null, null, Map.of("cleanersContacted", contacted));

        int cancelled = sequencer.cancelJobBroadcast(job.id());
        if (cancelled > 0) {
            log.debug("Cancelled {} pending broadcast phase(s) for exhausted job {}", cancelled, job.id());
        }
    }

    /**
     * Re-send the offer to whoever holds the pending assignment.
     *
     * @return true if there was a pending offer to nudge
     */
    public boolean nudgePendingOffer(long jobId) {
        Optional<CleanerAssignment> live = assignments.findLiveByJobId(jobId);
        if (live.isEmpty() || !live.get().isPending()) {
            return false;
        }
        Optional<Job> job = jobs.findById(jobId);
        Optional<Cleaner> cleaner = cleaners.findById(live.get().cleanerId());
        if (job.isEmpty() || cleaner.isEmpty()) {
            return false;
        }

        notifications.chatCleaner(cleaner.get(), composer.urgentOfferNudge(job.get()), jobId);
        events.record(job.get().tenantId(), SystemEventType.URGENT_FOLLOW_UP_SENT, SOURCE,
                "Urgent nudge on pending offer", jobId, cleaner.get().id());
        return true;
    }

    /**
     * Treat offers older than {@code olderThan} as declined.
     *
     * @return number of offers expired by this call
     */
    public int expireStaleOffers(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int expired = 0;
        for (CleanerAssignment stale : assignments.findPendingAssignedBefore(cutoff)) {
            ResponseResult result = handleDeclined(stale.id(), SystemEventType.OFFER_EXPIRED, false);
            if (result.status() == ResponseResult.Status.DECLINED) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} stale offer(s) assigned before {}", expired, cutoff);
        }
        return expired;
    }

    /**
     * Move a job to another date and notify the customer and its crew member.
     */
    public RescheduleOutcome rescheduleJob(long jobId, LocalDate newDate) {
        if (newDate == null) {
            throw new IllegalArgumentException("newDate is required");
        }
        Optional<Job> job = jobs.findById(jobId);
        if (job.isEmpty()) {
            return RescheduleOutcome.failed("job not found: " + jobId);
        }
        return rescheduler.reschedule(job.get(), newDate, job.get().serviceDate(), true);
    }

    public AssignmentStats assignmentStats(long jobId) {
        List<CleanerAssignment> history = assignments.findByJobId(jobId);
        int pending = 0;
        int confirmed = 0;
        int declined = 0;
        int cancelled = 0;
        List<Long> contacted = new ArrayList<>();
        for (CleanerAssignment a : history) {
            switch (a.status()) {
                case PENDING -> pending++;
                case CONFIRMED -> confirmed++;
                case DECLINED -> declined++;
                case CANCELLED -> cancelled++;
            }
            if (!contacted.contains(a.cleanerId())) {
                contacted.add(a.cleanerId());
            }
        }
        return new AssignmentStats(jobId, history.size(), pending, confirmed, declined, cancelled, contacted);
    }
}
