package crewdesk.workflow.repository;

import crewdesk.workflow.model.Cleaner;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for crew members.
 */
public interface CleanerRepository {

    Cleaner insert(Cleaner cleaner);

    Optional<Cleaner> findById(long cleanerId);

    /**
     * Active crew members in roster order (team leads first, then by id).
     *
     * @param tenantId tenant filter, or null for all tenants
     */
    List<Cleaner> findActive(String tenantId);
}
