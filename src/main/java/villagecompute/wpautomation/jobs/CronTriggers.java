package villagecompute.wpautomation.jobs;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;
import villagecompute.wpautomation.exceptions.ValidationException;

/**
 * Trigger arithmetic for schedules: expression resolution, validation and next-fire computation.
 *
 * <p>
 * Expressions use the 5-field UNIX cron syntax (minute, hour, day of month, month, day of week with Monday = 1) and are
 * evaluated in the schedule's own zone, so {@code DAILY} fires at 08:00 local time across DST changes.
 */
public final class CronTriggers {

    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronTriggers() {
        // Utility class, no instantiation
    }

    /**
     * Returns the expression in effect for {@code type}: the canonical one for named intervals, {@code custom} for
     * CUSTOM, {@code null} for ONCE.
     */
    public static String resolveExpression(ScheduleType type, String custom) {
        if (type == null) {
            throw new ValidationException("Schedule type is required");
        }
        return switch (type) {
            case ONCE -> null;
            case CUSTOM -> custom == null ? null : custom.trim();
            default -> type.getCanonicalExpression();
        };
    }

    /**
     * Parses and validates {@code expression}.
     *
     * @throws ValidationException
     *             if the expression is blank or not valid UNIX cron
     */
    public static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Invalid cron expression: expression is required");
        }
        try {
            return PARSER.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression: " + expression, e);
        }
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * <p>
     * For one-shot triggers this is {@code runAt} when it is still in the future and empty otherwise.
     */
    public static Optional<Instant> nextFireTime(ScheduleTrigger trigger, Instant after) {
        if (trigger.isOneShot()) {
            return Optional.ofNullable(trigger.runAt()).filter(runAt -> runAt.isAfter(after));
        }
        return nextFireTime(trigger.expression(), trigger.zone(), after);
    }

    public static Optional<Instant> nextFireTime(String expression, ZoneId zone, Instant after) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        return executionTime.nextExecution(ZonedDateTime.ofInstant(after, zone)).map(ZonedDateTime::toInstant);
    }
}
