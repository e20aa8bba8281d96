package crewdesk.workflow.followup;

import crewdesk.workflow.config.WorkflowConfig;
import crewdesk.workflow.model.ReminderType;
import crewdesk.workflow.model.ScheduleResult;
import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskStatus;
import crewdesk.workflow.model.TaskType;
import crewdesk.workflow.scheduler.TaskScheduler;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a business event into a timed plan of scheduled tasks.
 * <p>
 * Every task gets a deterministic dedup key, so calling a schedule method
 * twice for the same lead or job does not duplicate live work, and a plan can
 * be cancelled by key later.
 */
public class FollowUpSequencer {

    private static final Logger log = LoggerFactory.getLogger(FollowUpSequencer.class);

    /** Stage n (1-based) performs the action at index n-1 */
    static final List<FollowUpAction> LEAD_STAGE_ACTIONS = List.of(
            FollowUpAction.TEXT,
            FollowUpAction.CALL,
            FollowUpAction.DOUBLE_CALL,
            FollowUpAction.TEXT,
            FollowUpAction.CALL);

    static final LocalTime DAY_BEFORE_REMINDER_TIME = LocalTime.of(16, 0);

    private final TaskScheduler scheduler;
    private final WorkflowConfig config;
    private final Clock clock;

    public FollowUpSequencer(TaskScheduler scheduler, WorkflowConfig config, Clock clock) {
        this.scheduler = scheduler;
        this.config = config;
        this.clock = clock;
    }

    public static String leadStageKey(long leadId, int stage) {
        return "lead-" + leadId + "-stage-" + stage;
    }

    public static String broadcastKey(long jobId, BroadcastPhase phase) {
        return "job-" + jobId + "-broadcast-" + phase.keySuffix();
    }

    public static String dayBeforeReminderKey(long jobId) {
        return "reminder-" + jobId + "-day-before";
    }

    public static String jobReminderKey(long jobId, long cleanerId, ReminderType type) {
        return "reminder-" + jobId + "-" + cleanerId + "-" + type.keySuffix();
    }

    public static String postServiceKey(long jobId) {
        return "post-service-" + jobId;
    }

    /**
     * Schedule the lead sequence with the configured stage delays.
     */
    public List<ScheduleResult> scheduleLeadFollowUp(String tenantId, long leadId, String phone, String name) {
        return scheduleLeadFollowUp(tenantId, leadId, phone, name, config.leadFollowUpDelaysMinutes());
    }

    /**
     * Schedule one task per delay, stage 1 first. Delays are minutes from now.
     *
     * @param delaysMinutes one entry per stage, at most five
     * @return one result per stage
     */
    public List<ScheduleResult> scheduleLeadFollowUp(String tenantId, long leadId, String phone, String name,
            List<Integer> delaysMinutes) {
        requireText(phone, "phone");
        if (delaysMinutes == null || delaysMinutes.isEmpty()) {
            throw new IllegalArgumentException("at least one stage delay is required");
        }
        if (delaysMinutes.size() > LEAD_STAGE_ACTIONS.size()) {
            throw new IllegalArgumentException("at most " + LEAD_STAGE_ACTIONS.size() + " stages are supported");
        }

        Instant base = clock.instant();
        List<ScheduleResult> results = new ArrayList<>();
        for (int i = 0; i < delaysMinutes.size(); i++) {
            Integer delay = delaysMinutes.get(i);
            if (delay == null || delay < 0) {
                throw new IllegalArgumentException("stage delays must be non-negative");
            }
            int stage = i + 1;
            LeadFollowUpPayload payload = new LeadFollowUpPayload(leadId, phone, name, stage,
                    LEAD_STAGE_ACTIONS.get(i));
            results.add(scheduler.schedule(TaskType.LEAD_FOLLOW_UP, leadStageKey(leadId, stage),
                    base.plus(Duration.ofMinutes(delay)), payload, config.defaultMaxAttempts(), tenantId));
        }

        log.info("Lead {} follow-up planned: {} stages", leadId, results.size());
        return results;
    }

    /**
     * Schedule the initial, urgent and escalation phases for a job.
     */
    public List<ScheduleResult> scheduleJobBroadcast(String tenantId, long jobId, List<Long> candidateLeadIds) {
        List<Long> candidates = candidateLeadIds != null ? List.copyOf(candidateLeadIds) : List.of();

        Instant base = clock.instant();
        List<ScheduleResult> results = new ArrayList<>();
        for (BroadcastPhase phase : BroadcastPhase.values()) {
            JobBroadcastPayload payload = new JobBroadcastPayload(jobId, phase, candidates);
            results.add(scheduler.schedule(TaskType.JOB_BROADCAST, broadcastKey(jobId, phase),
                    base.plus(Duration.ofMinutes(phase.offsetMinutes())), payload,
                    config.defaultMaxAttempts(), tenantId));
        }

        log.info("Job {} broadcast planned", jobId);
        return results;
    }

    /**
     * Remind the customer at 16:00 business time on the day before.
     */
    public ScheduleResult scheduleDayBeforeReminder(String tenantId, long jobId, String phone, String name,
            LocalDate appointmentDate) {
        requireText(phone, "phone");
        if (appointmentDate == null) {
            throw new IllegalArgumentException("appointmentDate is required");
        }

        Instant dueAt = dayBeforeReminderTime(appointmentDate);
        DayBeforeReminderPayload payload = new DayBeforeReminderPayload(jobId, phone, name, appointmentDate);
        return scheduler.schedule(TaskType.DAY_BEFORE_REMINDER, dayBeforeReminderKey(jobId), dueAt, payload,
                config.defaultMaxAttempts(), tenantId);
    }

    /**
     * Move a still-pending day-before reminder to a job's new date, keeping
     * its recipient. A reminder that already ran or is running is left alone.
     *
     * @return true if a reminder was re-planned
     */
    public boolean moveDayBeforeReminder(long jobId, LocalDate newDate) {
        String key = dayBeforeReminderKey(jobId);
        Optional<ScheduledTask> pending = scheduler.findByDedupKey(key)
                .filter(task -> task.status() == TaskStatus.PENDING);
        if (pending.isEmpty()) {
            return false;
        }

        DayBeforeReminderPayload current = Jsons.fromJson(pending.get().payload(), DayBeforeReminderPayload.class);
        if (newDate.equals(current.appointmentDate()) || scheduler.cancel(key) == 0) {
            return false;
        }
        scheduleDayBeforeReminder(pending.get().tenantId(), jobId, current.phone(), current.name(), newDate);
        log.info("Day-before reminder for job {} moved from {} to {}", jobId, current.appointmentDate(), newDate);
        return true;
    }

    Instant dayBeforeReminderTime(LocalDate appointmentDate) {
        return appointmentDate.minusDays(1)
                .atTime(DAY_BEFORE_REMINDER_TIME)
                .atZone(config.businessZone())
                .toInstant();
    }

    /**
     * Remind the crew member one hour before the visit, or at its start.
     */
    public ScheduleResult scheduleJobReminder(long jobId, long cleanerId, ReminderType reminderType,
            Instant appointmentStart) {
        if (reminderType == null || appointmentStart == null) {
            throw new IllegalArgumentException("reminderType and appointmentStart are required");
        }

        Instant dueAt = switch (reminderType) {
            case ONE_HOUR -> appointmentStart.minus(Duration.ofHours(1));
            case JOB_START -> appointmentStart;
        };
        JobReminderPayload payload = new JobReminderPayload(jobId, cleanerId, reminderType);
        return scheduler.schedule(TaskType.JOB_REMINDER, jobReminderKey(jobId, cleanerId, reminderType), dueAt,
                payload);
    }

    public ScheduleResult schedulePostServiceFollowUp(long jobId, String phone, String name, Instant completedAt) {
        requireText(phone, "phone");
        Instant base = completedAt != null ? completedAt : clock.instant();
        PostServiceFollowUpPayload payload = new PostServiceFollowUpPayload(jobId, phone, name);
        return scheduler.schedule(TaskType.POST_SERVICE_FOLLOW_UP, postServiceKey(jobId),
                base.plus(config.postServiceDelay()), payload);
    }

    /**
     * Cancel every pending stage of a lead's sequence (the lead replied or booked).
     *
     * @return number of tasks cancelled
     */
    public int cancelLeadFollowUp(long leadId) {
        List<String> keys = new ArrayList<>();
        for (int stage = 1; stage <= LEAD_STAGE_ACTIONS.size(); stage++) {
            keys.add(leadStageKey(leadId, stage));
        }
        return scheduler.cancelAll(keys);
    }

    public int cancelJobBroadcast(long jobId) {
        List<String> keys = new ArrayList<>();
        for (BroadcastPhase phase : BroadcastPhase.values()) {
            keys.add(broadcastKey(jobId, phase));
        }
        return scheduler.cancelAll(keys);
    }

    public int cancelDayBeforeReminder(long jobId) {
        return scheduler.cancel(dayBeforeReminderKey(jobId));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
