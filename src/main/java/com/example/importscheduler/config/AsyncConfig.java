package com.example.importscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Threads used by the import scheduler.
 * <p>
 * - importPollScheduler runs the poll loop and the periodic housekeeping jobs
 * - importJobExecutor runs one claimed job per thread; admission is limited by
 *   the polling service, not by the pool
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Worker threads for claimed jobs.
     * Unbounded because jobs cancelled by a stop keep their thread until the
     * processor returns, while the freed slot may already be reused.
     */
    @Bean(name = "importJobExecutor", destroyMethod = "shutdown")
    public ExecutorService importJobExecutor() {
        log.info("Creating import job executor");

        var threadFactory = new CustomizableThreadFactory("import-job-");
        threadFactory.setDaemon(false);

        return Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Scheduler for the poll loop and @Scheduled housekeeping.
     * A fixed-delay task never overlaps with itself, so one poll tick runs at a time.
     */
    @Bean(name = "importPollScheduler")
    public ThreadPoolTaskScheduler importPollScheduler() {
        log.info("Configuring import poll scheduler");

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("import-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();

        return scheduler;
    }
}
