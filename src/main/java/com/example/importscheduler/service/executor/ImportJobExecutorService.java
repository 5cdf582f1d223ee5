package com.example.importscheduler.service.executor;

import com.example.importscheduler.config.ImportSchedulerProperties;
import com.example.importscheduler.config.MetricsConfig;
import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.exception.ImportJobProcessingException;
import com.example.importscheduler.service.processor.CancellationSignal;
import com.example.importscheduler.service.processor.ImportJobProcessor;
import com.example.importscheduler.service.store.ImportJobStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Runs a single claimed job to its next persisted state.
 * <p>
 * Handles:
 * - Start log
 * - Processor invocation
 * - Cancellation, which wins over both success and failure
 * - Error records and the retry-or-fail decision
 * - Metrics recording
 * <p>
 * Nothing is thrown back to the caller; every outcome is written to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportJobExecutorService {

    static final String PROCESS_STAGE = "process";

    private final ImportJobStore jobStore;
    private final MetricsConfig metricsConfig;
    private final ImportSchedulerProperties properties;

    /**
     * Execute a job that has already been claimed (status RUNNING).
     *
     * @param job       the claimed job
     * @param processor the processor doing the actual import
     * @param signal    cancellation signal owned by the scheduler loop
     */
    public void execute(ImportJob job, ImportJobProcessor processor, CancellationSignal signal) {
        var jobId = job.getId();
        var timerSample = metricsConfig.startExecutionTimer();

        try {
            log.info("Starting job {} (kind: {}, source: {})", jobId, job.getKind(), job.getSourceId());
            jobStore.appendLog(jobId, ImportJobLogLevel.INFO, "Starting job " + jobId);

            // Errors from the processor (linkage, stack overflow) are job failures like any other
            Throwable failure = null;
            try {
                processor.process(job, signal);
            } catch (Throwable t) {
                failure = t;
            }

            if (signal.isCancelled()) {
                handleCancellation(job, timerSample);
            } else if (failure == null) {
                handleSuccess(job, timerSample);
            } else {
                handleFailure(job, failure, timerSample);
            }
        } catch (Exception e) {
            // Store failure while recording the outcome; the job stays RUNNING until recovered
            log.error("Failed to record outcome of job {}: {}", jobId, e.getMessage(), e);
            metricsConfig.recordExecution(timerSample, job.getKind(), "error");
        }
    }

    private void handleCancellation(ImportJob job, Timer.Sample timerSample) {
        var jobId = job.getId();

        if (!jobStore.finalizeJob(jobId, ImportJobStatus.FAILED, Instant.now())) {
            log.warn("Job {} was cancelled but is no longer running, leaving it as is", jobId);
        }
        jobStore.appendLog(jobId, ImportJobLogLevel.WARN, "Job " + jobId + " was cancelled");
        log.warn("Job {} was cancelled", jobId);

        metricsConfig.recordCancellation(job.getKind());
        metricsConfig.recordExecution(timerSample, job.getKind(), "cancelled");
    }

    private void handleSuccess(ImportJob job, Timer.Sample timerSample) {
        var jobId = job.getId();

        if (!jobStore.finalizeJob(jobId, ImportJobStatus.SUCCESS, Instant.now())) {
            log.warn("Job {} finished but is no longer running, result not recorded", jobId);
            metricsConfig.recordExecution(timerSample, job.getKind(), "discarded");
            return;
        }
        jobStore.appendLog(jobId, ImportJobLogLevel.INFO, "Job " + jobId + " completed successfully");
        log.info("Job {} completed successfully", jobId);

        metricsConfig.recordExecution(timerSample, job.getKind(), "success");
    }

    private void handleFailure(ImportJob job, Throwable failure, Timer.Sample timerSample) {
        var jobId = job.getId();
        var message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();

        String errorCode = null;
        String externalId = null;
        if (failure instanceof ImportJobProcessingException processingException) {
            errorCode = processingException.getErrorCode();
            externalId = processingException.getExternalId();
        }

        jobStore.appendError(jobId, PROCESS_STAGE, message, errorCode, externalId);
        var errorCount = jobStore.incrementErrorCount(jobId);
        var maxRetries = properties.getMaxRetries();

        if (errorCount < maxRetries) {
            if (!jobStore.finalizeJob(jobId, ImportJobStatus.QUEUED, null)) {
                log.warn("Job {} failed but is no longer running, not requeued", jobId);
            }
            jobStore.appendLog(jobId, ImportJobLogLevel.WARN,
                    "Job " + jobId + " failed, will retry (" + errorCount + "/" + maxRetries + ")",
                    Map.of("error", message, "attempt", errorCount));
            log.warn("Job {} failed, will retry ({}/{}): {}", jobId, errorCount, maxRetries, message);

            metricsConfig.recordRetry(job.getKind(), errorCount);
        } else {
            if (!jobStore.finalizeJob(jobId, ImportJobStatus.FAILED, Instant.now())) {
                log.warn("Job {} failed but is no longer running, not marked failed", jobId);
            }
            jobStore.appendLog(jobId, ImportJobLogLevel.ERROR,
                    "Job " + jobId + " failed permanently after " + maxRetries + " retries",
                    Map.of("error", message, "attempt", errorCount));
            log.error("Job {} failed permanently after {} retries: {}", jobId, maxRetries, message, failure);

            metricsConfig.recordPermanentFailure(job.getKind());
        }

        metricsConfig.recordExecution(timerSample, job.getKind(), "failure");
    }
}
