package com.example.importscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the import job scheduler.
 * Loaded from application.yml once at startup.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "import-scheduler")
public class ImportSchedulerProperties {

    /**
     * Delay in milliseconds between the end of one poll tick and the start of the next
     */
    @Min(1)
    private long pollIntervalMs = 5000;

    /**
     * Failed attempts after which a job is failed permanently instead of requeued
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * Maximum number of jobs this process executes at the same time
     */
    @Min(1)
    private int concurrentJobs = 2;

    /**
     * Start polling as soon as the application is ready
     */
    private boolean autoStart = true;

    /**
     * Running jobs claimed longer ago than this are put back in the queue.
     * 0 disables the sweep.
     */
    @Min(0)
    private int staleJobThresholdMinutes = 0;

    /**
     * Interval in milliseconds between stale job sweeps
     */
    @Min(1000)
    private long staleJobCheckIntervalMs = 300000;

    /**
     * Interval in milliseconds between refreshes of the job status gauges
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;
}
