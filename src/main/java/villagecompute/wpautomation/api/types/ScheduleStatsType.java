package villagecompute.wpautomation.api.types;

/**
 * Aggregate counters across one user's schedules.
 *
 * @param successRate
 *            {@code round(successfulRuns / totalRuns * 100)}, 0 when nothing has run
 */
public record ScheduleStatsType(int total, int active, long totalRuns, long successfulRuns, long failedRuns,
        long successRate) {
}
