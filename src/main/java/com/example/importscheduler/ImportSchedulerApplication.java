package com.example.importscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Import Job Scheduler Application
 * <p>
 * A persistent background scheduler for long-running import jobs.
 * <p>
 * Features:
 * - Jobs survive restarts in a relational store
 * - Conditional claims so several instances can share one queue
 * - Bounded number of concurrently running jobs per instance
 * - Capped retries with durable logs and error records
 * - Cooperative cancellation on stop
 */
@EnableScheduling
@SpringBootApplication
public class ImportSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImportSchedulerApplication.class, args);
    }
}
