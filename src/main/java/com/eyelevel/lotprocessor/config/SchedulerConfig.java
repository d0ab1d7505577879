package com.eyelevel.lotprocessor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configures the scheduler that drives the batch loop. A single thread guarantees that two
 * reconciliation passes never overlap, so no job is ever reconciled concurrently with itself.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    /**
     * Creates the scheduler used by every {@code @Scheduled} method in the application.
     *
     * @return A single-threaded TaskScheduler bean.
     */
    @Bean("taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("lot-scheduler-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error escaped a scheduled tick", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
