package com.example.lxmon.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler backing the engine's periodic loops. One thread per loop so that
 * a slow pass of one loop never delays another.
 */
@Configuration
public class SchedulerConfig {

    @Bean(name = "engineScheduler")
    public ThreadPoolTaskScheduler engineScheduler(EngineProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getEngine().getSchedulerPoolSize()));
        scheduler.setThreadNamePrefix("lxmon-engine-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getEngine().getShutdownTimeoutSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
