package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import villagecompute.wpautomation.data.models.AutomationExecution;
import villagecompute.wpautomation.data.models.AutomationSchedule;

/**
 * Persistence for schedules and their firing history.
 */
public interface AutomationScheduleStore {

    AutomationSchedule create(AutomationSchedule schedule);

    Optional<AutomationSchedule> findById(UUID id);

    Optional<AutomationSchedule> findForOwner(UUID userId, UUID id);

    List<AutomationSchedule> listForOwner(UUID userId);

    List<AutomationSchedule> listActive();

    Optional<AutomationSchedule> findActiveForFeed(UUID userId, UUID rssFeedId);

    AutomationSchedule update(UUID id, Consumer<AutomationSchedule> mutation);

    /**
     * Atomically bumps the run counters and stores the last and next fire times.
     */
    void recordRun(UUID id, Instant ranAt, boolean success, Instant nextRunAt);

    boolean delete(UUID userId, UUID id);

    AutomationExecution recordExecution(AutomationExecution execution);

    /**
     * Firing history, newest first.
     */
    List<AutomationExecution> listExecutions(UUID scheduleId, int page, int size);
}
