package villagecompute.wpautomation.api.types;

/**
 * Job counts per status plus whether the worker is busy.
 */
public record QueueStatsType(long pending, long generating, long generated, long publishing, long published,
        long failed, boolean processing) {
}
