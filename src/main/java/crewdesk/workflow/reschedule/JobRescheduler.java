package crewdesk.workflow.reschedule;

import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.FollowUpSequencer;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.NotificationService;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Moves a job to a new date and tells the customer and the assigned crew
 * member. The date change is committed first; a pending day-before reminder
 * follows the job, and notifications are best effort.
 */
public class JobRescheduler {

    private static final Logger log = LoggerFactory.getLogger(JobRescheduler.class);
    private static final String SOURCE = "job-rescheduler";

    private final JobRepository jobs;
    private final CleanerRepository cleaners;
    private final NotificationService notifications;
    private final MessageComposer composer;
    private final SystemEventLog events;
    private final FollowUpSequencer sequencer;
    private final Clock clock;

    public JobRescheduler(JobRepository jobs, CleanerRepository cleaners, NotificationService notifications,
            MessageComposer composer, SystemEventLog events, FollowUpSequencer sequencer, Clock clock) {
        this.jobs = jobs;
        this.cleaners = cleaners;
        this.notifications = notifications;
        this.composer = composer;
        this.events = events;
        this.sequencer = sequencer;
        this.clock = clock;
    }

    public RescheduleOutcome reschedule(Job job, LocalDate targetDate, LocalDate originalDate,
            boolean sendNotifications) {
        try {
            if (!jobs.updateServiceDate(job.id(), targetDate, clock.instant())) {
                log.warn("Job {} disappeared before it could be moved to {}", job.id(), targetDate);
                return RescheduleOutcome.failed("job not found");
            }
        } catch (RuntimeException e) {
            log.error("Failed to move job {} to {}", job.id(), targetDate, e);
            return RescheduleOutcome.failed(e.getMessage());
        }

        try {
            sequencer.moveDayBeforeReminder(job.id(), targetDate);
        } catch (RuntimeException e) {
            log.warn("Job {} moved to {} but its day-before reminder was not re-planned: {}", job.id(), targetDate,
                    e.getMessage());
        }

        int sent = 0;
        if (sendNotifications) {
            if (job.hasCustomerPhone() && notifications.smsCustomer(job.customerPhone(),
                    composer.rescheduleCustomer(job, originalDate, targetDate), job.id())) {
                sent++;
            }

            if (job.cleanerId() != null) {
                Optional<Cleaner> cleaner = cleaners.findById(job.cleanerId());
                if (cleaner.isPresent() && notifications.chatCleaner(cleaner.get(),
                        composer.rescheduleCleaner(job, originalDate, targetDate), job.id())) {
                    sent++;
                }
            }
        }

        events.record(job.tenantId(), SystemEventType.JOB_RESCHEDULED, SOURCE,
                "Job moved from " + originalDate + " to " + targetDate, job.id(), job.cleanerId(), null,
                Map.of("from", originalDate.toString(), "to", targetDate.toString(), "notificationsSent", sent));
        log.info("Job {} moved {} -> {} ({} notifications)", job.id(), originalDate, targetDate, sent);

        return RescheduleOutcome.moved(sent);
    }
}
