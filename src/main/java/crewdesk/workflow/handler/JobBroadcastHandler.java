package crewdesk.workflow.handler;

import crewdesk.workflow.cascade.AssignmentCascade;
import crewdesk.workflow.cascade.OfferResult;
import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.JobBroadcastPayload;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.NotificationService;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.scheduler.TaskHandler;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Drives a job's broadcast phases. The first two phases push the assignment
 * cascade; the last one tells the owner if the job is still unstaffed.
 * Once the job is confirmed or closed every phase is a no-op.
 */
public class JobBroadcastHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(JobBroadcastHandler.class);
    private static final String SOURCE = "job-broadcast";

    private final JobRepository jobs;
    private final AssignmentCascade cascade;
    private final NotificationService notifications;
    private final MessageComposer composer;
    private final SystemEventLog events;

    public JobBroadcastHandler(JobRepository jobs, AssignmentCascade cascade, NotificationService notifications,
            MessageComposer composer, SystemEventLog events) {
        this.jobs = jobs;
        this.cascade = cascade;
        this.notifications = notifications;
        this.composer = composer;
        this.events = events;
    }

    @Override
    public TaskType type() {
        return TaskType.JOB_BROADCAST;
    }

    @Override
    public void handle(ScheduledTask task) {
        JobBroadcastPayload payload = Jsons.fromJson(task.payload(), JobBroadcastPayload.class);

        Optional<Job> found = jobs.findById(payload.jobId());
        if (found.isEmpty()) {
            log.warn("Broadcast {} for unknown job {}, skipping", payload.phase(), payload.jobId());
            return;
        }
        Job job = found.get();
        if (job.cleanerConfirmed() || !job.status().isAssignable()) {
            log.debug("Job {} already settled ({}), broadcast {} skipped", job.id(), job.status(), payload.phase());
            return;
        }

        switch (payload.phase()) {
            case INITIAL -> {
                OfferResult result = cascade.startAssignment(job.id());
                log.info("Initial broadcast for job {}: {}", job.id(), result.status());
            }
            case URGENT -> {
                OfferResult result = cascade.startAssignment(job.id());
                if (result.status() == OfferResult.Status.ALREADY_OFFERED) {
                    cascade.nudgePendingOffer(job.id());
                }
                log.info("Urgent broadcast for job {}: {}", job.id(), result.status());
            }
            case ESCALATE -> {
                notifications.smsOwner(composer.broadcastEscalation(job), job.id());
                events.record(job.tenantId(), SystemEventType.OWNER_ACTION_REQUIRED, SOURCE,
                        "No cleaner confirmed after broadcast", job.id(), null, null,
                        Map.of("candidateLeads", payload.candidateLeadIds().size()));
                log.warn("Job {} still unstaffed after broadcast, owner notified", job.id());
            }
        }
    }
}
