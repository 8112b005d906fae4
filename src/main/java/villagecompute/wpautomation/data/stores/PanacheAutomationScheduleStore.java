package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.data.models.AutomationExecution;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;

/**
 * {@link AutomationScheduleStore} backed by {@code automation_schedules} and {@code automation_executions}.
 */
@ApplicationScoped
public class PanacheAutomationScheduleStore implements AutomationScheduleStore {

    private static final Logger LOG = Logger.getLogger(PanacheAutomationScheduleStore.class);

    @Override
    public AutomationSchedule create(AutomationSchedule schedule) {
        QuarkusTransaction.requiringNew().run(() -> {
            schedule.createdAt = Instant.now();
            schedule.updatedAt = schedule.createdAt;
            schedule.persist();
            LOG.infof("Created schedule %s (%s, type: %s, active: %b)", schedule.id, schedule.name,
                    schedule.scheduleType, schedule.isActive);
        });
        return schedule;
    }

    @Override
    public Optional<AutomationSchedule> findById(UUID id) {
        return QuarkusTransaction.requiringNew()
                .call(() -> AutomationSchedule.<AutomationSchedule>findByIdOptional(id));
    }

    @Override
    public Optional<AutomationSchedule> findForOwner(UUID userId, UUID id) {
        return findById(id).filter(schedule -> schedule.userId.equals(userId));
    }

    @Override
    public List<AutomationSchedule> listForOwner(UUID userId) {
        return QuarkusTransaction.requiringNew().call(() -> AutomationSchedule.findByUser(userId));
    }

    @Override
    public List<AutomationSchedule> listActive() {
        return QuarkusTransaction.requiringNew().call(AutomationSchedule::findActive);
    }

    @Override
    public Optional<AutomationSchedule> findActiveForFeed(UUID userId, UUID rssFeedId) {
        return QuarkusTransaction.requiringNew().call(() -> AutomationSchedule.findActiveForFeed(userId, rssFeedId));
    }

    @Override
    public AutomationSchedule update(UUID id, Consumer<AutomationSchedule> mutation) {
        return QuarkusTransaction.requiringNew().call(() -> {
            AutomationSchedule schedule = AutomationSchedule.<AutomationSchedule>findByIdOptional(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Schedule not found: " + id));
            mutation.accept(schedule);
            schedule.updatedAt = Instant.now();
            schedule.persist();
            return schedule;
        });
    }

    @Override
    public void recordRun(UUID id, Instant ranAt, boolean success, Instant nextRunAt) {
        QuarkusTransaction.requiringNew().run(() -> {
            String counter = success ? "successfulRuns" : "failedRuns";
            int updated = AutomationSchedule.update(
                    "lastRunAt = :ranAt, nextRunAt = :nextRunAt, totalRuns = totalRuns + 1, " + counter + " = "
                            + counter + " + 1, updatedAt = :now WHERE id = :id",
                    Parameters.with("ranAt", ranAt).and("nextRunAt", nextRunAt).and("now", Instant.now()).and("id",
                            id));
            if (updated == 0) {
                LOG.warnf("Schedule %s disappeared before its run could be recorded", id);
            }
        });
    }

    @Override
    public boolean delete(UUID userId, UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> {
            AutomationExecution.delete("scheduleId = :id AND userId = :userId",
                    Parameters.with("id", id).and("userId", userId));
            return AutomationSchedule.delete("id = :id AND userId = :userId",
                    Parameters.with("id", id).and("userId", userId)) > 0;
        });
    }

    @Override
    public AutomationExecution recordExecution(AutomationExecution execution) {
        QuarkusTransaction.requiringNew().run(execution::persist);
        return execution;
    }

    @Override
    public List<AutomationExecution> listExecutions(UUID scheduleId, int page, int size) {
        return QuarkusTransaction.requiringNew()
                .call(() -> AutomationExecution.<AutomationExecution>find("scheduleId = :scheduleId",
                        Sort.descending("startedAt"), Parameters.with("scheduleId", scheduleId))
                        .page(Page.of(page, size)).list());
    }
}
