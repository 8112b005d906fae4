package villagecompute.wpautomation.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Periodic wake-up for the {@link ArticleJobWorker}, so jobs left PENDING (for example after a restart or a lost
 * signal) are picked up without a new firing.
 */
@ApplicationScoped
public class ArticleJobPollScheduler {

    @Inject
    ArticleJobWorker worker;

    @Scheduled(
            every = "${automation.worker.poll-interval:5s}",
            identity = "article-job-poll",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        worker.signal();
    }
}
