package villagecompute.wpautomation.services;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import io.micrometer.core.instrument.MeterRegistry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.api.types.ScheduledPostRequestType;
import villagecompute.wpautomation.data.models.ScheduledPost;
import villagecompute.wpautomation.data.models.ScheduledPost.PostStatus;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.data.stores.ScheduledPostStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.exceptions.ValidationException;

/**
 * Queues finished posts for publication at a local time and publishes them once due.
 *
 * <p>
 * The requested time is read in the post's timezone and stored as a UTC instant. A publish claims the post first
 * (PUBLISHING, {@code attempts + 1}) so the minute dispatcher and a manual publish never send the same post twice.
 * The outcome is PUBLISHED with the remote post id, or FAILED with the error message; a FAILED post stays FAILED until
 * it is rescheduled.
 */
@ApplicationScoped
public class ScheduledPostService {

    private static final Logger LOG = Logger.getLogger(ScheduledPostService.class);

    static final int MAX_PAGE_SIZE = 100;
    static final String UNKNOWN_ERROR = "Unknown error";

    private static final Set<PostStatus> RESCHEDULABLE = EnumSet.of(PostStatus.PENDING, PostStatus.FAILED);
    private static final Set<PostStatus> PUBLISHABLE_NOW = EnumSet.of(PostStatus.PENDING, PostStatus.FAILED,
            PostStatus.CANCELLED);

    @Inject
    ScheduledPostStore postStore;

    @Inject
    SiteStore siteStore;

    @Inject
    WordPressPublishService publishService;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "automation.default-timezone",
            defaultValue = "UTC")
    String defaultTimezone;

    @ConfigProperty(
            name = "automation.scheduled-posts.batch-size",
            defaultValue = "100")
    int batchSize;

    /**
     * @throws ValidationException
     *             if the title, content or time is missing, or the timezone is unknown
     * @throws ResourceNotFoundException
     *             if the site is missing or foreign
     */
    public ScheduledPost schedule(UUID userId, ScheduledPostRequestType request) {
        if (request == null) {
            throw new ValidationException("Scheduled post request is required");
        }
        requireText(request.title(), "Title");
        requireText(request.content(), "Content");
        if (request.scheduledFor() == null) {
            throw new ValidationException("A publish time is required");
        }
        siteStore.findSite(request.siteId()).filter(site -> site.userId.equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + request.siteId()));
        ZoneId zone = zone(request.timezone());

        ScheduledPost post = new ScheduledPost();
        post.userId = userId;
        post.siteId = request.siteId();
        post.title = request.title().trim();
        post.content = request.content();
        post.excerpt = request.excerpt();
        post.categoryIds = copy(request.categoryIds());
        post.tagIds = copy(request.tagIds());
        post.featuredMediaId = request.featuredMediaId();
        post.timezone = zone.getId();
        post.scheduledFor = request.scheduledFor().atZone(zone).toInstant();
        post.status = PostStatus.PENDING;
        post.createdAt = clock.instant();
        post.updatedAt = post.createdAt;

        ScheduledPost saved = postStore.create(post);
        LOG.infof("User %s scheduled post %s for %s (%s)", userId, saved.id, saved.scheduledFor, saved.timezone);
        return saved;
    }

    /**
     * Changes a PENDING post. A new local time is read in the new timezone when one is given, otherwise in the current
     * one; a timezone on its own does not move the instant.
     *
     * @throws InvalidStateTransitionException
     *             if the post is not PENDING
     */
    public ScheduledPost update(UUID userId, UUID postId, ScheduledPostRequestType request) {
        ScheduledPost current = requireOwned(userId, postId);
        if (request == null) {
            throw new ValidationException("Scheduled post request is required");
        }
        ZoneId zone = request.timezone() != null && !request.timezone().isBlank() ? zone(request.timezone())
                : ZoneId.of(current.timezone);

        ScheduledPost updated = postStore.update(postId, post -> {
            if (post.status != PostStatus.PENDING) {
                throw new InvalidStateTransitionException("Cannot update a post that is " + post.status);
            }
            if (request.title() != null && !request.title().isBlank()) {
                post.title = request.title().trim();
            }
            if (request.content() != null && !request.content().isBlank()) {
                post.content = request.content();
            }
            if (request.excerpt() != null) {
                post.excerpt = request.excerpt();
            }
            if (request.categoryIds() != null) {
                post.categoryIds = copy(request.categoryIds());
            }
            if (request.tagIds() != null) {
                post.tagIds = copy(request.tagIds());
            }
            if (request.featuredMediaId() != null) {
                post.featuredMediaId = request.featuredMediaId();
            }
            if (request.scheduledFor() != null) {
                post.scheduledFor = request.scheduledFor().atZone(zone).toInstant();
            }
            post.timezone = zone.getId();
        });
        LOG.infof("Scheduled post %s updated, due at %s", postId, updated.scheduledFor);
        return updated;
    }

    /**
     * Moves a PENDING or FAILED post to a new time and makes it PENDING again with its attempts reset.
     */
    public ScheduledPost reschedule(UUID userId, UUID postId, LocalDateTime scheduledFor, String timezone) {
        ScheduledPost current = requireOwned(userId, postId);
        if (scheduledFor == null) {
            throw new ValidationException("A publish time is required");
        }
        ZoneId zone = timezone != null && !timezone.isBlank() ? zone(timezone) : ZoneId.of(current.timezone);

        ScheduledPost rescheduled = postStore.update(postId, post -> {
            requireStatus(post, RESCHEDULABLE, "reschedule");
            post.scheduledFor = scheduledFor.atZone(zone).toInstant();
            post.timezone = zone.getId();
            post.status = PostStatus.PENDING;
            post.attempts = 0;
            post.lastError = null;
        });
        LOG.infof("Scheduled post %s rescheduled to %s", postId, rescheduled.scheduledFor);
        return rescheduled;
    }

    public ScheduledPost cancel(UUID userId, UUID postId) {
        requireOwned(userId, postId);
        ScheduledPost cancelled = postStore.update(postId, post -> {
            requireStatus(post, RESCHEDULABLE, "cancel");
            post.status = PostStatus.CANCELLED;
        });
        LOG.infof("Scheduled post %s cancelled by user %s", postId, userId);
        return cancelled;
    }

    /**
     * Publishes the post on the caller's thread regardless of its time.
     *
     * @return the post after the attempt, PUBLISHED or FAILED
     * @throws InvalidStateTransitionException
     *             if the post is already published or being published
     */
    public ScheduledPost publishNow(UUID userId, UUID postId) {
        requireOwned(userId, postId);
        ScheduledPost claimed = postStore.update(postId, post -> {
            if (post.status == PostStatus.PUBLISHED) {
                throw new InvalidStateTransitionException("Post is already published");
            }
            requireStatus(post, PUBLISHABLE_NOW, "publish");
            claim(post);
        });
        LOG.infof("Immediate publish of scheduled post %s requested by user %s", postId, userId);
        return publish(claimed);
    }

    /**
     * Publishes every PENDING post that is due, one at a time. A post claimed elsewhere in the meantime is skipped.
     *
     * @return the number of posts attempted
     */
    public int publishDue() {
        List<ScheduledPost> due = postStore.listDue(clock.instant(), batchSize);
        if (due.isEmpty()) {
            return 0;
        }
        LOG.infof("Found %d due scheduled post(s)", due.size());
        int attempted = 0;
        for (ScheduledPost candidate : due) {
            Optional<ScheduledPost> claimed = claimDue(candidate.id);
            if (claimed.isPresent()) {
                publish(claimed.get());
                attempted++;
            }
        }
        return attempted;
    }

    public ScheduledPost get(UUID userId, UUID postId) {
        return requireOwned(userId, postId);
    }

    public List<ScheduledPost> list(UUID userId, UUID siteId, PostStatus status, int page, int size) {
        return postStore.listForOwner(userId, siteId, status, Math.max(0, page),
                Math.max(1, Math.min(size, MAX_PAGE_SIZE)));
    }

    public void delete(UUID userId, UUID postId) {
        requireOwned(userId, postId);
        postStore.delete(userId, postId);
        LOG.infof("Scheduled post %s deleted by user %s", postId, userId);
    }

    private Optional<ScheduledPost> claimDue(UUID postId) {
        try {
            return Optional.of(postStore.update(postId, post -> {
                requireStatus(post, EnumSet.of(PostStatus.PENDING), "publish");
                claim(post);
            }));
        } catch (InvalidStateTransitionException | ResourceNotFoundException e) {
            LOG.debugf("Skipping scheduled post %s: %s", postId, e.getMessage());
            return Optional.empty();
        }
    }

    private ScheduledPost publish(ScheduledPost claimed) {
        try {
            Site site = siteStore.findSite(claimed.siteId)
                    .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + claimed.siteId));
            PublishResultType result = publishService.publishScheduled(site, claimed);
            ScheduledPost published = postStore.update(claimed.id, post -> {
                post.status = PostStatus.PUBLISHED;
                post.wpPostId = result.postId();
                post.publishedAt = clock.instant();
                post.lastError = null;
            });
            meterRegistry.counter("automation.scheduled_posts.published", "result", "published").increment();
            return published;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : UNKNOWN_ERROR;
            LOG.errorf(e, "Failed to publish scheduled post %s (attempt %d): %s", claimed.id, claimed.attempts,
                    message);
            meterRegistry.counter("automation.scheduled_posts.published", "result", "failed").increment();
            return postStore.update(claimed.id, post -> {
                post.status = PostStatus.FAILED;
                post.lastError = message;
            });
        }
    }

    private static void claim(ScheduledPost post) {
        post.status = PostStatus.PUBLISHING;
        post.attempts++;
    }

    private static void requireStatus(ScheduledPost post, Set<PostStatus> allowed, String action) {
        if (!allowed.contains(post.status)) {
            throw new InvalidStateTransitionException(
                    "Cannot " + action + " scheduled post " + post.id + " while it is " + post.status);
        }
    }

    private ScheduledPost requireOwned(UUID userId, UUID postId) {
        return postStore.findForOwner(userId, postId)
                .orElseThrow(() -> new ResourceNotFoundException("Scheduled post not found: " + postId));
    }

    private ZoneId zone(String timezone) {
        String id = timezone == null || timezone.isBlank() ? defaultTimezone : timezone.trim();
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + id, e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static List<Long> copy(List<Long> ids) {
        return ids == null ? null : new ArrayList<>(ids);
    }
}
