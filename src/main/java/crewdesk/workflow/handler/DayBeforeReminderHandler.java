package crewdesk.workflow.handler;

import crewdesk.workflow.events.SystemEventLog;
import crewdesk.workflow.followup.DayBeforeReminderPayload;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.notify.Channel;
import crewdesk.workflow.notify.MessageComposer;
import crewdesk.workflow.notify.MessageSender;
import crewdesk.workflow.notify.SendResult;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.scheduler.TaskExecutionException;
import crewdesk.workflow.scheduler.TaskHandler;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

public class DayBeforeReminderHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(DayBeforeReminderHandler.class);
    private static final String SOURCE = "day-before-reminder";

    private final JobRepository jobs;
    private final MessageSender sender;
    private final MessageComposer composer;
    private final SystemEventLog events;

    public DayBeforeReminderHandler(JobRepository jobs, MessageSender sender, MessageComposer composer,
            SystemEventLog events) {
        this.jobs = jobs;
        this.sender = sender;
        this.composer = composer;
        this.events = events;
    }

    @Override
    public TaskType type() {
        return TaskType.DAY_BEFORE_REMINDER;
    }

    @Override
    public void handle(ScheduledTask task) {
        DayBeforeReminderPayload payload = Jsons.fromJson(task.payload(), DayBeforeReminderPayload.class);

        Optional<Job> job = jobs.findById(payload.jobId());
        if (job.isPresent() && job.get().status() == JobStatus.CANCELLED) {
            log.info("Job {} was cancelled, day-before reminder skipped", payload.jobId());
            return;
        }
        if (job.isPresent() && !job.get().serviceDate().equals(payload.appointmentDate())) {
            log.info("Job {} moved from {} to {}, stale day-before reminder skipped", payload.jobId(),
                    payload.appointmentDate(), job.get().serviceDate());
            return;
        }

        SendResult result = sender.send(Channel.SMS, payload.phone(),
                composer.dayBeforeReminder(payload.name(), payload.appointmentDate()));
        if (!result.success()) {
            throw new TaskExecutionException("Reminder SMS for job " + payload.jobId() + " failed: "
                    + result.error());
        }

        events.record(task.tenantId(), SystemEventType.REMINDER_SENT, SOURCE, "Day-before reminder sent",
                payload.jobId(), null, payload.phone(), Map.of("appointmentDate", payload.appointmentDate().toString()));
    }
}
