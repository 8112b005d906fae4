package villagecompute.wpautomation.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.services.ScheduledPostService;

/**
 * Publishes scheduled posts once their time has passed.
 *
 * <p>
 * Runs every minute, so a post goes live at most about a minute after its scheduled time. Each run hands the due posts
 * to {@link ScheduledPostService#publishDue()}; a run still in progress when the next one is due makes that one skip.
 */
@ApplicationScoped
public class ScheduledPostPublishScheduler {

    private static final Logger LOG = Logger.getLogger(ScheduledPostPublishScheduler.class);

    @Inject
    ScheduledPostService scheduledPostService;

    @ConfigProperty(
            name = "automation.scheduled-posts.enabled",
            defaultValue = "true")
    boolean enabled;

    @Scheduled(
            every = "1m",
            identity = "scheduled-post-publish",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void publishDuePosts() {
        if (!enabled) {
            LOG.debug("Scheduled post publishing disabled (automation.scheduled-posts.enabled=false)");
            return;
        }
        LOG.debugf("Scheduled post publish triggered");

        try {
            int attempted = scheduledPostService.publishDue();
            if (attempted > 0) {
                LOG.infof("Scheduled post run attempted %d post(s)", attempted);
            }
        } catch (RuntimeException e) {
            // the next run retries whatever is still PENDING
            LOG.errorf(e, "Scheduled post publish run failed: %s", e.getMessage());
        }
    }
}
