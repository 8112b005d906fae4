package villagecompute.wpautomation.config;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.jobs.SchedulerRegistry;
import villagecompute.wpautomation.services.ScheduleDispatcher;

/**
 * Wires the schedule timers: the shared {@link Clock} and the {@link SchedulerRegistry} with its executor.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code automation.scheduler.pool-size} - timer threads shared by all schedules (default 2)</li>
 * </ul>
 */
@ApplicationScoped
public class SchedulerConfig {

    private static final Logger LOG = Logger.getLogger(SchedulerConfig.class);

    @ConfigProperty(
            name = "automation.scheduler.pool-size",
            defaultValue = "2")
    int poolSize;

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public SchedulerRegistry schedulerRegistry(ScheduleDispatcher dispatcher, Clock clock) {
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(Math.max(1, poolSize),
                new ThreadFactoryBuilder().setNameFormat("schedule-timer-%d").setDaemon(true).build());
        LOG.infof("Schedule registry created with %d timer thread(s)", Math.max(1, poolSize));
        return new SchedulerRegistry(executor, clock, dispatcher::fire);
    }

    void closeSchedulerRegistry(@Disposes SchedulerRegistry registry) {
        LOG.infof("Shutting down schedule registry (%d armed)", registry.size());
        registry.shutdown();
    }
}
