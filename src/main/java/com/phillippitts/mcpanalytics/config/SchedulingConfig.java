package com.phillippitts.mcpanalytics.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for the background snapshot flush and the time source used by the analytics engine.
 *
 * <p>One thread: the periodic flush is the only task.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger LOG = LogManager.getLogger(SchedulingConfig.class);

    /**
     * Creates the scheduler that drives periodic snapshot saves.
     *
     * <p>Thread naming: {@code analytics-flush-N} for easy identification in logs.
     *
     * <p>Shutdown: scheduled tasks are not waited for; the final save runs synchronously
     * from the telemetry service when the context stops, not on this pool.
     *
     * @return scheduler for snapshot flushes
     */
    @Bean(name = "analyticsScheduler")
    public TaskScheduler analyticsScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("analytics-flush-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> LOG.error("Scheduled analytics task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    /**
     * UTC clock shared by recording, summaries and snapshot defaults. Tests substitute a fixed clock.
     *
     * @return system UTC clock
     */
    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }
}
