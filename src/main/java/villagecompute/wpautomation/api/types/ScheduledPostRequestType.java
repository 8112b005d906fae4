package villagecompute.wpautomation.api.types;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Fields accepted when scheduling a post. On update a {@code null} field keeps its current value.
 *
 * @param siteId
 *            target WordPress site, ignored on update
 * @param title
 *            post title
 * @param content
 *            post body HTML
 * @param excerpt
 *            optional excerpt
 * @param categoryIds
 *            WordPress category ids
 * @param tagIds
 *            WordPress tag ids
 * @param featuredMediaId
 *            media library id of the featured image
 * @param scheduledFor
 *            local date-time in {@code timezone}
 * @param timezone
 *            IANA zone, defaults to the configured zone
 */
public record ScheduledPostRequestType(UUID siteId, String title, String content, String excerpt,
        List<Long> categoryIds, List<Long> tagIds, Long featuredMediaId, LocalDateTime scheduledFor,
        String timezone) {
}
