package com.example.importscheduler.config;

import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.service.store.ImportJobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring the import scheduler.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status
 * - Jobs executing in this process
 * - Claims and claim contention
 * - Retries, permanent failures and cancellations
 * - Execution time by kind and outcome
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ImportJobStore jobStore;

    private final ConcurrentHashMap<ImportJobStatus, AtomicLong> statusCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : ImportJobStatus.values()) {
            var counter = new AtomicLong(0);
            statusCounters.put(status, counter);

            Gauge.builder("import_scheduler_jobs", counter, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of import jobs by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh status gauges from the store
     */
    @Scheduled(fixedDelayString = "${import-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : ImportJobStatus.values()) {
                statusCounters.get(status).set(jobStore.countByStatus(status));
            }
        } catch (Exception e) {
            log.warn("Failed to refresh import job gauges: {}", e.getMessage());
        }
    }

    /**
     * Gauge over the map of jobs currently executing in this process
     */
    public void bindActiveJobs(Map<?, ?> activeJobs) {
        Gauge.builder("import_scheduler_active_jobs", activeJobs, Map::size)
                .description("Import jobs executing in this process")
                .register(meterRegistry);
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, ImportJobKind kind, String outcome) {
        sample.stop(Timer.builder("import_scheduler_execution_time")
                .tag("kind", kind != null ? kind.getCode() : "unknown")
                .tag("outcome", outcome)
                .description("Import job execution time")
                .register(meterRegistry));
    }

    public void recordClaim() {
        meterRegistry.counter("import_scheduler_claims").increment();
    }

    /**
     * Another scheduler instance claimed the candidate first
     */
    public void recordClaimMiss() {
        meterRegistry.counter("import_scheduler_claim_misses").increment();
    }

    public void recordPollError(String errorType) {
        meterRegistry.counter("import_scheduler_poll_errors",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry(ImportJobKind kind, int attemptNumber) {
        meterRegistry.counter("import_scheduler_retries",
                "kind", kind != null ? kind.getCode() : "unknown",
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordPermanentFailure(ImportJobKind kind) {
        meterRegistry.counter("import_scheduler_permanent_failures",
                "kind", kind != null ? kind.getCode() : "unknown"
        ).increment();
    }

    public void recordCancellation(ImportJobKind kind) {
        meterRegistry.counter("import_scheduler_cancellations",
                "kind", kind != null ? kind.getCode() : "unknown"
        ).increment();
    }
}
