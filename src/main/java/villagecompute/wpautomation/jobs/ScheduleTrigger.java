package villagecompute.wpautomation.jobs;

import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;

/**
 * Immutable snapshot of a schedule's trigger, handed to the {@link SchedulerRegistry} so timers never hold entities.
 *
 * @param scheduleId
 *            schedule to fire
 * @param type
 *            trigger kind
 * @param expression
 *            cron expression for interval and CUSTOM kinds, {@code null} for ONCE
 * @param zone
 *            zone the expression is evaluated in
 * @param runAt
 *            absolute instant for ONCE, otherwise {@code null}
 */
public record ScheduleTrigger(UUID scheduleId, ScheduleType type, String expression, ZoneId zone, Instant runAt) {

    public static ScheduleTrigger from(AutomationSchedule schedule) {
        ZoneId zone = ZoneId.of(schedule.timezone == null || schedule.timezone.isBlank() ? "UTC" : schedule.timezone);
        String expression = CronTriggers.resolveExpression(schedule.scheduleType, schedule.cronExpression);
        return new ScheduleTrigger(schedule.id, schedule.scheduleType, expression, zone, schedule.scheduledFor);
    }

    public boolean isOneShot() {
        return type == ScheduleType.ONCE;
    }
}
