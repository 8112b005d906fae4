package villagecompute.wpautomation.services;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.FiringResultType;
import villagecompute.wpautomation.api.types.ScheduleRequestType;
import villagecompute.wpautomation.api.types.ScheduleStatsType;
import villagecompute.wpautomation.data.models.AutomationExecution;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;
import villagecompute.wpautomation.data.stores.AutomationScheduleStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.jobs.CronTriggers;
import villagecompute.wpautomation.jobs.ScheduleTrigger;
import villagecompute.wpautomation.jobs.SchedulerRegistry;

/**
 * Manages a user's automation schedules and keeps the {@link SchedulerRegistry} in step with them.
 *
 * <p>
 * Every save validates the trigger up front (an invalid CUSTOM expression is rejected with
 * {@link ValidationException}), stores the next fire time and re-registers the schedule when it is active. Pausing or
 * deleting unregisters it; a firing already in progress is allowed to finish.
 *
 * <p>
 * On startup every active schedule is registered ({@code automation.scheduler.enabled}).
 */
@ApplicationScoped
@Startup
public class AutomationScheduleService {

    private static final Logger LOG = Logger.getLogger(AutomationScheduleService.class);

    static final int MAX_PAGE_SIZE = 100;

    @Inject
    AutomationScheduleStore scheduleStore;

    @Inject
    SiteStore siteStore;

    @Inject
    SchedulerRegistry registry;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "automation.default-timezone",
            defaultValue = "UTC")
    String defaultTimezone;

    @ConfigProperty(
            name = "automation.scheduler.enabled",
            defaultValue = "true")
    boolean schedulerEnabled;

    @PostConstruct
    void onStart() {
        if (!schedulerEnabled) {
            LOG.info("Schedule registration on startup disabled (automation.scheduler.enabled=false)");
            return;
        }
        initializeAll();
    }

    /**
     * Registers every active schedule. A schedule that cannot be armed is logged and skipped.
     *
     * @return the number of schedules registered
     */
    public int initializeAll() {
        int registered = 0;
        for (AutomationSchedule schedule : scheduleStore.listActive()) {
            try {
                registry.register(ScheduleTrigger.from(schedule));
                registered++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to register schedule %s (%s): %s", schedule.id, schedule.name, e.getMessage());
            }
        }
        LOG.infof("Registered %d active schedule(s)", registered);
        return registered;
    }

    public AutomationSchedule create(UUID userId, ScheduleRequestType request) {
        AutomationSchedule schedule = new AutomationSchedule();
        schedule.userId = userId;
        applyRequest(schedule, userId, request);

        AutomationSchedule saved = scheduleStore.create(schedule);
        LOG.infof("User %s created schedule %s (%s, %s)", userId, saved.id, saved.name, saved.scheduleType);
        syncRegistration(saved);
        return saved;
    }

    public AutomationSchedule update(UUID userId, UUID scheduleId, ScheduleRequestType request) {
        requireOwned(userId, scheduleId);
        AutomationSchedule validated = new AutomationSchedule();
        validated.userId = userId;
        applyRequest(validated, userId, request);

        AutomationSchedule saved = scheduleStore.update(scheduleId, s -> copyRequestFields(validated, s));
        LOG.infof("Schedule %s updated", scheduleId);
        syncRegistration(saved);
        return saved;
    }

    /**
     * Changes only the trigger of a schedule.
     */
    public AutomationSchedule reschedule(UUID userId, UUID scheduleId, ScheduleType scheduleType,
            String cronExpression, String timezone, LocalDateTime scheduledFor) {
        AutomationSchedule current = requireOwned(userId, scheduleId);
        ScheduleRequestType request = new ScheduleRequestType(current.siteId, current.rssFeedId, current.name,
                current.description, scheduleType, cronExpression, timezone != null ? timezone : current.timezone,
                scheduledFor, current.autoPublish, current.publishStatus, current.maxArticles, current.isActive);
        return update(userId, scheduleId, request);
    }

    public AutomationSchedule pause(UUID userId, UUID scheduleId) {
        requireOwned(userId, scheduleId);
        AutomationSchedule paused = scheduleStore.update(scheduleId, s -> s.isActive = false);
        registry.unregister(scheduleId);
        LOG.infof("Schedule %s paused", scheduleId);
        return paused;
    }

    public AutomationSchedule resume(UUID userId, UUID scheduleId) {
        AutomationSchedule current = requireOwned(userId, scheduleId);
        Instant next = computeNextRun(ScheduleTrigger.from(current));
        AutomationSchedule resumed = scheduleStore.update(scheduleId, s -> {
            s.isActive = true;
            s.nextRunAt = next;
        });
        syncRegistration(resumed);
        LOG.infof("Schedule %s resumed, next run at %s", scheduleId, next);
        return resumed;
    }

    /**
     * Fires the schedule now on the caller's thread.
     *
     * @return the firing result, or empty when the schedule was already firing
     * @throws ValidationException
     *             if the schedule is paused
     */
    public Optional<FiringResultType> runNow(UUID userId, UUID scheduleId) {
        AutomationSchedule schedule = requireOwned(userId, scheduleId);
        if (!schedule.isActive) {
            throw new ValidationException("Schedule is paused; resume it before running it");
        }
        LOG.infof("Manual run of schedule %s requested by user %s", scheduleId, userId);
        Optional<FiringResultType> result = registry.fireNow(scheduleId);
        if (schedule.scheduleType == ScheduleType.ONCE && result.isPresent()) {
            registry.unregister(scheduleId);
        }
        return result;
    }

    public void delete(UUID userId, UUID scheduleId) {
        requireOwned(userId, scheduleId);
        registry.unregister(scheduleId);
        scheduleStore.delete(userId, scheduleId);
        LOG.infof("Schedule %s deleted by user %s", scheduleId, userId);
    }

    public AutomationSchedule get(UUID userId, UUID scheduleId) {
        return requireOwned(userId, scheduleId);
    }

    public List<AutomationSchedule> list(UUID userId) {
        return scheduleStore.listForOwner(userId);
    }

    public ScheduleStatsType getStats(UUID userId) {
        List<AutomationSchedule> schedules = scheduleStore.listForOwner(userId);
        int active = (int) schedules.stream().filter(s -> s.isActive).count();
        long totalRuns = schedules.stream().mapToLong(s -> s.totalRuns).sum();
        long successful = schedules.stream().mapToLong(s -> s.successfulRuns).sum();
        long failed = schedules.stream().mapToLong(s -> s.failedRuns).sum();
        long rate = totalRuns == 0 ? 0 : Math.round((double) successful / totalRuns * 100);
        return new ScheduleStatsType(schedules.size(), active, totalRuns, successful, failed, rate);
    }

    public List<AutomationExecution> listExecutions(UUID userId, UUID scheduleId, int page, int size) {
        requireOwned(userId, scheduleId);
        return scheduleStore.listExecutions(scheduleId, Math.max(0, page), Math.max(1, Math.min(size, MAX_PAGE_SIZE)));
    }

    private AutomationSchedule requireOwned(UUID userId, UUID scheduleId) {
        return scheduleStore.findForOwner(userId, scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule not found: " + scheduleId));
    }

    private void syncRegistration(AutomationSchedule schedule) {
        if (schedule.isActive) {
            registry.register(ScheduleTrigger.from(schedule));
        } else {
            registry.unregister(schedule.id);
        }
    }

    private void applyRequest(AutomationSchedule schedule, UUID userId, ScheduleRequestType request) {
        if (request == null) {
            throw new ValidationException("Schedule request is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Schedule name is required");
        }
        if (request.scheduleType() == null) {
            throw new ValidationException("Schedule type is required");
        }
        siteStore.findSite(request.siteId()).filter(site -> site.userId.equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + request.siteId()));
        if (request.rssFeedId() != null) {
            siteStore.findFeed(request.rssFeedId()).filter(feed -> feed.userId.equals(userId))
                    .orElseThrow(() -> new ResourceNotFoundException("Feed not found: " + request.rssFeedId()));
        }

        String publishStatus = request.publishStatus() == null || request.publishStatus().isBlank()
                ? AutomationSchedule.PUBLISH_STATUS_DRAFT
                : request.publishStatus();
        ArticleJobService.validatePublishStatus(publishStatus);

        String timezone = request.timezone() == null || request.timezone().isBlank() ? defaultTimezone
                : request.timezone().trim();
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + timezone, e);
        }

        String expression = null;
        Instant scheduledFor = null;
        if (request.scheduleType() == ScheduleType.ONCE) {
            if (request.scheduledFor() == null) {
                throw new ValidationException("A run time is required for a one-time schedule");
            }
            scheduledFor = request.scheduledFor().atZone(zone).toInstant();
        } else {
            expression = CronTriggers.resolveExpression(request.scheduleType(), request.cronExpression());
            CronTriggers.parse(expression);
        }

        schedule.siteId = request.siteId();
        schedule.rssFeedId = request.rssFeedId();
        schedule.name = request.name().trim();
        schedule.description = request.description();
        schedule.scheduleType = request.scheduleType();
        schedule.cronExpression = request.scheduleType() == ScheduleType.CUSTOM ? expression : null;
        schedule.timezone = zone.getId();
        schedule.scheduledFor = scheduledFor;
        schedule.autoPublish = request.autoPublish();
        schedule.publishStatus = publishStatus;
        schedule.maxArticles = request.maxArticles();
        schedule.isActive = request.active();
        schedule.nextRunAt = request.active() ? computeNextRun(new ScheduleTrigger(null, request.scheduleType(),
                expression, zone, scheduledFor)) : null;
    }

    private static void copyRequestFields(AutomationSchedule from, AutomationSchedule to) {
        to.siteId = from.siteId;
        to.rssFeedId = from.rssFeedId;
        to.name = from.name;
        to.description = from.description;
        to.scheduleType = from.scheduleType;
        to.cronExpression = from.cronExpression;
        to.timezone = from.timezone;
        to.scheduledFor = from.scheduledFor;
        to.autoPublish = from.autoPublish;
        to.publishStatus = from.publishStatus;
        to.maxArticles = from.maxArticles;
        to.isActive = from.isActive;
        to.nextRunAt = from.nextRunAt;
    }

    private Instant computeNextRun(ScheduleTrigger trigger) {
        if (trigger.isOneShot()) {
            return trigger.runAt();
        }
        return CronTriggers.nextFireTime(trigger, clock.instant()).orElse(null);
    }
}
