package villagecompute.wpautomation.api.types;

import java.util.UUID;

/**
 * Outcome of one schedule firing.
 *
 * @param scheduleId
 *            schedule that fired
 * @param itemsFound
 *            feed items considered (after the per-firing cap)
 * @param jobsCreated
 *            new PENDING jobs
 * @param duplicatesSkipped
 *            items already tied to a job for the feed
 * @param itemsFailed
 *            items whose job creation raised an error
 * @param success
 *            whether the firing counts as a successful run
 */
public record FiringResultType(UUID scheduleId, int itemsFound, int jobsCreated, int duplicatesSkipped,
        int itemsFailed, boolean success) {

    public static FiringResultType skipped(UUID scheduleId) {
        return new FiringResultType(scheduleId, 0, 0, 0, 0, true);
    }
}
