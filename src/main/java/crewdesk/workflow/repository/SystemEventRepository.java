package crewdesk.workflow.repository;

import crewdesk.workflow.model.SystemEvent;

import java.util.List;

/**
 * Append-only audit log.
 */
public interface SystemEventRepository {

    void append(SystemEvent event);

    List<SystemEvent> findByJobId(long jobId);

    List<SystemEvent> findRecent(int limit);
}
