package crewdesk.workflow.events;

import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.SystemEvent;
import crewdesk.workflow.model.SystemEventType;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.repository.SystemEventRepository;
import crewdesk.workflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Writes audit events. Recording is best effort: a store failure is logged
 * and never reaches the caller, whose own work has already happened.
 *
 * Callers that hold the tenant pass it. Otherwise an event tied to a job
 * takes the job's tenant, and an event with no job has none.
 */
public class SystemEventLog {

    private static final Logger log = LoggerFactory.getLogger(SystemEventLog.class);

    private final SystemEventRepository repository;
    private final JobRepository jobs;
    private final Clock clock;

    public SystemEventLog(SystemEventRepository repository, JobRepository jobs, Clock clock) {
        this.repository = repository;
        this.jobs = jobs;
        this.clock = clock;
    }

    public void record(SystemEventType type, String source, String message, Long jobId, Long cleanerId) {
        record(type, source, message, jobId, cleanerId, null, Map.of());
    }

    public void record(SystemEventType type, String source, String message, Long jobId, Long cleanerId,
            String phone, Map<String, ?> metadata) {
        record(tenantOf(jobId), type, source, message, jobId, cleanerId, phone, metadata);
    }

    public void record(String tenantId, SystemEventType type, String source, String message, Long jobId,
            Long cleanerId) {
        record(tenantId, type, source, message, jobId, cleanerId, null, Map.of());
    }

    public void record(String tenantId, SystemEventType type, String source, String message, Long jobId,
            Long cleanerId, String phone, Map<String, ?> metadata) {
        try {
            String metadataJson = metadata == null || metadata.isEmpty() ? null : Jsons.toJson(metadata);
            repository.append(new SystemEvent(0L, tenantId, source, type, message, jobId, cleanerId, phone,
                    metadataJson, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} event for job {}: {}", type, jobId, e.getMessage());
        }
    }

    public List<SystemEvent> forJob(long jobId) {
        return repository.findByJobId(jobId);
    }

    public List<SystemEvent> recent(int limit) {
        return repository.findRecent(limit);
    }

    private String tenantOf(Long jobId) {
        if (jobId == null) {
            return null;
        }
        try {
            return jobs.findById(jobId).map(Job::tenantId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not resolve tenant for job {}: {}", jobId, e.getMessage());
            return null;
        }
    }
}
