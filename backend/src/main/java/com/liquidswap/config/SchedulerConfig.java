package com.liquidswap.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for the wallet sync job. Ticks never run concurrently; an exception escaping a tick
 * is logged and the schedule continues.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SYNC_SCHEDULER = "sync-scheduler";

    @Bean(name = SYNC_SCHEDULER)
    public ThreadPoolTaskScheduler syncScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("wallet-sync-");
        scheduler.setErrorHandler(t -> log.error("Scheduled wallet task failed", t));
        scheduler.initialize();
        return scheduler;
    }
}
