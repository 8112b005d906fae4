package villagecompute.wpautomation.api.types;

import java.time.LocalDateTime;
import java.util.UUID;

import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;

/**
 * Fields accepted when creating or updating a schedule.
 *
 * @param siteId
 *            target WordPress site
 * @param rssFeedId
 *            feed to read on each firing, may be {@code null}
 * @param name
 *            display name
 * @param description
 *            optional notes
 * @param scheduleType
 *            trigger kind
 * @param cronExpression
 *            5-field expression, required for CUSTOM only
 * @param timezone
 *            IANA zone the trigger is evaluated in, defaults to the configured zone
 * @param scheduledFor
 *            local date-time in {@code timezone}, required for ONCE only
 * @param autoPublish
 *            publish generated articles immediately
 * @param publishStatus
 *            "draft" or "publish"
 * @param maxArticles
 *            items taken per firing, defaults to 20
 * @param active
 *            arm the schedule on save
 */
public record ScheduleRequestType(UUID siteId, UUID rssFeedId, String name, String description,
        ScheduleType scheduleType, String cronExpression, String timezone, LocalDateTime scheduledFor,
        boolean autoPublish, String publishStatus, Integer maxArticles, boolean active) {
}
