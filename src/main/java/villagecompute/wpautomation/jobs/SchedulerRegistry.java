package villagecompute.wpautomation.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.FiringResultType;

/**
 * Owns the live timers of every armed schedule.
 *
 * <p>
 * Each registered schedule has exactly one pending one-shot timer on the shared executor, set for its next fire time.
 * When the timer fires the {@link FiringHandler} runs and, for recurring triggers, the next timer is armed from the
 * clock. A ONCE trigger whose instant has already passed fires immediately and is not re-armed.
 *
 * <p>
 * Firings of one schedule never overlap: a timer or {@link #fireNow} that finds the schedule already firing is
 * skipped. Different schedules fire independently on the executor's threads.
 *
 * <p>
 * {@link #register} and {@link #unregister} are the only mutators. The instance is created by
 * {@link villagecompute.wpautomation.config.SchedulerConfig} and torn down on shutdown.
 */
public class SchedulerRegistry {

    private static final Logger LOG = Logger.getLogger(SchedulerRegistry.class);

    /**
     * Work performed when a schedule fires.
     */
    @FunctionalInterface
    public interface FiringHandler {
        FiringResultType fire(UUID scheduleId);
    }

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final FiringHandler handler;

    private final Map<UUID, Registration> registrations = new ConcurrentHashMap<>();
    private final Set<UUID> firing = ConcurrentHashMap.newKeySet();

    public SchedulerRegistry(ScheduledExecutorService executor, Clock clock, FiringHandler handler) {
        this.executor = executor;
        this.clock = clock;
        this.handler = handler;
    }

    /**
     * Arms (or re-arms) the timer for {@code trigger.scheduleId()}, replacing any existing registration.
     */
    public void register(ScheduleTrigger trigger) {
        cancel(registrations.remove(trigger.scheduleId()));

        Instant now = clock.instant();
        Instant fireAt;
        if (trigger.isOneShot()) {
            if (trigger.runAt() == null) {
                LOG.warnf("Schedule %s is ONCE without a run time, not arming", trigger.scheduleId());
                return;
            }
            fireAt = trigger.runAt().isAfter(now) ? trigger.runAt() : now;
        } else {
            Optional<Instant> next = CronTriggers.nextFireTime(trigger, now);
            if (next.isEmpty()) {
                LOG.warnf("Schedule %s has no future fire time for '%s', not arming", trigger.scheduleId(),
                        trigger.expression());
                return;
            }
            fireAt = next.get();
        }

        Registration registration = new Registration(trigger);
        registrations.put(trigger.scheduleId(), registration);
        arm(registration, fireAt, now);
        LOG.infof("Registered schedule %s (%s) next fire at %s", trigger.scheduleId(), trigger.type(), fireAt);
    }

    /**
     * Tears down the timer for {@code scheduleId}. A firing already in progress is allowed to finish.
     *
     * @return whether a registration existed
     */
    public boolean unregister(UUID scheduleId) {
        Registration removed = registrations.remove(scheduleId);
        cancel(removed);
        if (removed != null) {
            LOG.infof("Unregistered schedule %s", scheduleId);
        }
        return removed != null;
    }

    /**
     * Runs the schedule's firing on the caller's thread, honouring the per-schedule overlap guard. Errors propagate to
     * the caller.
     *
     * @return the firing result, or empty when the schedule was already firing
     */
    public Optional<FiringResultType> fireNow(UUID scheduleId) {
        if (!firing.add(scheduleId)) {
            LOG.infof("Schedule %s is already firing, manual run skipped", scheduleId);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(handler.fire(scheduleId));
        } finally {
            firing.remove(scheduleId);
        }
    }

    public boolean isRegistered(UUID scheduleId) {
        return registrations.containsKey(scheduleId);
    }

    public boolean isFiring(UUID scheduleId) {
        return firing.contains(scheduleId);
    }

    public Optional<Instant> nextFireTime(UUID scheduleId) {
        return Optional.ofNullable(registrations.get(scheduleId)).map(registration -> registration.fireAt);
    }

    public int size() {
        return registrations.size();
    }

    /**
     * Cancels every timer and stops the executor.
     */
    public void shutdown() {
        registrations.values().forEach(this::cancel);
        registrations.clear();
        executor.shutdownNow();
    }

    private void arm(Registration registration, Instant fireAt, Instant now) {
        long delayMillis = Math.max(0L, Duration.between(now, fireAt).toMillis());
        registration.fireAt = fireAt;
        registration.future = executor.schedule(() -> onTimer(registration), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void onTimer(Registration registration) {
        ScheduleTrigger trigger = registration.trigger;
        UUID scheduleId = trigger.scheduleId();
        if (registrations.get(scheduleId) != registration) {
            return;
        }

        if (firing.add(scheduleId)) {
            try {
                handler.fire(scheduleId);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Firing of schedule %s failed: %s", scheduleId, e.getMessage());
            } finally {
                firing.remove(scheduleId);
            }
        } else {
            LOG.warnf("Schedule %s still firing, skipping overlapping timer", scheduleId);
        }

        if (trigger.isOneShot()) {
            registrations.remove(scheduleId, registration);
            return;
        }
        if (registrations.get(scheduleId) != registration) {
            return;
        }

        Instant now = clock.instant();
        Instant after = now.isAfter(registration.fireAt) ? now : registration.fireAt;
        Optional<Instant> next = CronTriggers.nextFireTime(trigger, after);
        if (next.isPresent()) {
            arm(registration, next.get(), now);
            LOG.debugf("Schedule %s re-armed for %s", scheduleId, next.get());
        } else {
            registrations.remove(scheduleId, registration);
            LOG.warnf("Schedule %s has no further fire times", scheduleId);
        }
    }

    private void cancel(Registration registration) {
        if (registration != null && registration.future != null) {
            registration.future.cancel(false);
        }
    }

    private static final class Registration {
        private final ScheduleTrigger trigger;
        private volatile Instant fireAt;
        private volatile ScheduledFuture<?> future;

        private Registration(ScheduleTrigger trigger) {
            this.trigger = trigger;
        }
    }
}
