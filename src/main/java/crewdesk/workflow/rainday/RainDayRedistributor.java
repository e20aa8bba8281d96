package crewdesk.workflow.rainday;

import crewdesk.workflow.events.AlertService;
import crewdesk.workflow.model.AlertType;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.reschedule.JobRescheduler;
import crewdesk.workflow.reschedule.RescheduleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Moves every job off a weather-affected date.
 * <p>
 * In single-target mode all jobs go to one date. In auto-spread mode each job
 * goes to the least loaded of the next working days, counting jobs already
 * booked there. Jobs are processed one at a time; a failed move is reported
 * and the batch continues.
 */
public class RainDayRedistributor {

    private static final Logger log = LoggerFactory.getLogger(RainDayRedistributor.class);

    private final JobRepository jobs;
    private final JobRescheduler rescheduler;
    private final AlertService alerts;

    public RainDayRedistributor(JobRepository jobs, JobRescheduler rescheduler, AlertService alerts) {
        this.jobs = jobs;
        this.rescheduler = rescheduler;
        this.alerts = alerts;
    }

    public RescheduleResult reschedule(RescheduleRequest request) {
        request.validate();
        LocalDate affected = request.affectedDate();
        boolean notify = request.notificationsEnabled();

        List<Job> affectedJobs = jobs.findActiveOnDate(affected, request.tenantId());
        log.info("Rain-day reschedule for {}: {} job(s), mode={}", affected, affectedJobs.size(),
                request.singleTarget() ? "single-target" : RescheduleResult.AUTO_SPREAD);

        RescheduleResult result = request.singleTarget()
                ? moveAllTo(affected, request.resolvedTargetDate(), affectedJobs, notify)
                : spread(affected, request.resolvedSpreadDays(), request.tenantId(), affectedJobs, notify);

        if (result.jobsAffected() > 0) {
            alerts.raise(AlertType.RAIN_DAY_RESCHEDULE, null, result.jobsAffected(), result.jobsRescheduled(),
                    "Rain day " + affected + ": " + result.jobsRescheduled() + " of " + result.jobsAffected()
                            + " job(s) rescheduled, " + result.jobsFailed().size() + " failed");
        }
        log.info("Rain-day reschedule for {} done: {} moved, {} failed, {} notification(s)", affected,
                result.jobsRescheduled(), result.jobsFailed().size(), result.notificationsSent());
        return result;
    }

    private RescheduleResult moveAllTo(LocalDate affected, LocalDate target, List<Job> affectedJobs,
            boolean notify) {
        int moved = 0;
        int sent = 0;
        List<Long> failed = new ArrayList<>();
        for (Job job : affectedJobs) {
            RescheduleOutcome outcome = rescheduler.reschedule(job, target, affected, notify);
            if (outcome.success()) {
                moved++;
                sent += outcome.notificationsSent();
            } else {
                failed.add(job.id());
            }
        }

        Map<LocalDate, Integer> summary = moved > 0 ? Map.of(target, moved) : Map.of();
        return new RescheduleResult(affected, target.toString(), affectedJobs.size(), moved, failed, sent, summary);
    }

    private RescheduleResult spread(LocalDate affected, int spreadDays, String tenantId, List<Job> affectedJobs,
            boolean notify) {
        List<LocalDate> candidates = CandidateDates.after(affected, spreadDays);
        Map<LocalDate, Integer> prior = new HashMap<>();
        for (LocalDate date : candidates) {
            prior.put(date, jobs.countActiveOnDate(date, tenantId));
        }

        SpreadLoad load = SpreadLoad.of(candidates, prior);
        Map<LocalDate, Integer> summary = new TreeMap<>();
        int moved = 0;
        int sent = 0;
        List<Long> failed = new ArrayList<>();

        for (Job job : affectedJobs) {
            LocalDate target = load.leastLoaded();
            RescheduleOutcome outcome = rescheduler.reschedule(job, target, affected, notify);
            if (outcome.success()) {
                load = load.increment(target);
                summary.merge(target, 1, Integer::sum);
                moved++;
                sent += outcome.notificationsSent();
                log.debug("Job {} spread to {} (now {} job(s))", job.id(), target, load.countFor(target));
            } else {
                failed.add(job.id());
            }
        }

        return new RescheduleResult(affected, RescheduleResult.AUTO_SPREAD, affectedJobs.size(), moved, failed,
                sent, summary);
    }
}
