package crewdesk.workflow.handler;

import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.JobReminderPayload;
import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.SendResult;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.scheduler.TaskExecutionException;
import crewdesk.workflow.scheduler.TaskHandler;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Chat reminder to the crew member before or at the start of a visit.
 * Skipped when the job is gone, cancelled or now belongs to someone else.
 */
public class JobReminderHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(JobReminderHandler.class);
    private static final String SOURCE = "job-reminder";

    private final JobRepository jobs;
    private final CleanerRepository cleaners;
    private final MessageSender sender;
    private final MessageComposer composer;
    private final SystemEventLog events;

    public JobReminderHandler(JobRepository jobs, CleanerRepository cleaners, MessageSender sender,
            MessageComposer composer, SystemEventLog events) {
        this.jobs = jobs;
        this.cleaners = cleaners;
        this.sender = sender;
        this.composer = composer;
        this.events = events;
    }

    @Override
    public TaskType type() {
        return TaskType.JOB_REMINDER;
    }

    @Override
    public void handle(ScheduledTask task) {
        JobReminderPayload payload = Jsons.fromJson(task.payload(), JobReminderPayload.class);

        Optional<Job> job = jobs.findById(payload.jobId());
        if (job.isEmpty() || job.get().status() == JobStatus.CANCELLED) {
            log.info("Job {} gone or cancelled, {} reminder skipped", payload.jobId(), payload.reminderType());
            return;
        }
        if (job.get().cleanerId() != null && job.get().cleanerId() != payload.cleanerId()) {
            log.info("Job {} reassigned, reminder for cleaner {} skipped", payload.jobId(), payload.cleanerId());
            return;
        }

        Optional<Cleaner> cleaner = cleaners.findById(payload.cleanerId());
        if (cleaner.isEmpty() || !cleaner.get().hasChat()) {
            log.warn("Cleaner {} has no chat id, {} reminder for job {} skipped",
                    payload.cleanerId(), payload.reminderType(), payload.jobId());
            return;
        }

        SendResult result = sender.send(Channel.CHAT, cleaner.get().chatId(),
                composer.jobReminder(payload.reminderType(), job.get()));
        if (!result.success()) {
            throw new TaskExecutionException("Reminder chat for job " + payload.jobId() + " failed: "
                    + result.error());
        }

        events.record(job.get().tenantId(), SystemEventType.REMINDER_SENT, SOURCE,
                payload.reminderType().keySuffix() + " reminder sent", payload.jobId(), payload.cleanerId(), null,
                Map.of("reminderType", payload.reminderType().name()));
    }
}
