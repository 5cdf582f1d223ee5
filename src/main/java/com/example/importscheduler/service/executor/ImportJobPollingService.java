package com.example.importscheduler.service.executor;

import com.example.importscheduler.config.ImportSchedulerProperties;
import com.example.importscheduler.config.MetricsConfig;
import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.service.processor.CancellationSignal;
import com.example.importscheduler.service.processor.ImportJobProcessor;
import com.example.importscheduler.service.store.ImportJobStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the store for queued import jobs and launches them under a concurrency ceiling.
 * <p>
 * Flow:
 * 1. A fixed-delay poll tick runs while the scheduler is started
 * 2. If fewer than concurrent-jobs jobs are active, one job is claimed
 * 3. The claimed job is handed to the job executor without waiting for it
 * 4. When the job finishes its slot is freed for a later tick
 * <p>
 * Several instances may poll the same store; the conditional claim makes sure
 * each job is run by only one of them.
 */
@Slf4j
@Service
public class ImportJobPollingService {

    private final JobClaimService claimService;
    private final ImportJobExecutorService executorService;
    private final ImportJobStore jobStore;
    private final ImportSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final ExecutorService importJobExecutor;
    private final TaskScheduler importPollScheduler;

    private final AtomicReference<ImportJobProcessor> processor = new AtomicReference<>();
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final Map<UUID, CancellationSignal> activeJobs = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> pollTask;

    public ImportJobPollingService(JobClaimService claimService, ImportJobExecutorService executorService, ImportJobStore jobStore,
                                   ImportSchedulerProperties properties, MetricsConfig metricsConfig,
                                   @Qualifier("importJobExecutor") ExecutorService importJobExecutor,
                                   @Qualifier("importPollScheduler") TaskScheduler importPollScheduler,
                                   ObjectProvider<ImportJobProcessor> processorProvider) {
        this.claimService = claimService;
        this.executorService = executorService;
        this.jobStore = jobStore;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.importJobExecutor = importJobExecutor;
        this.importPollScheduler = importPollScheduler;
        this.processor.set(processorProvider.getIfUnique());

        metricsConfig.bindActiveJobs(activeJobs);
    }

    /**
     * Register the processor used for every claimed job. Replaces any previous one.
     */
    public void registerProcessor(ImportJobProcessor importJobProcessor) {
        processor.set(importJobProcessor);
        log.info("Registered import job processor {}", importJobProcessor.getClass().getName());
    }

    /**
     * Start polling. Does nothing if already started.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (!isRunning.compareAndSet(false, true)) {
                log.debug("Import scheduler already running");
                return;
            }

            pollTask = importPollScheduler.scheduleWithFixedDelay(this::pollCycle, Duration.ofMillis(properties.getPollIntervalMs()));
            log.info("Import scheduler started (poll interval: {}ms, concurrent jobs: {}, max retries: {})",
                    properties.getPollIntervalMs(), properties.getConcurrentJobs(), properties.getMaxRetries());
        }
    }

    /**
     * Stop polling and signal cancellation to every active job.
     * <p>
     * Returns without waiting for the jobs. Their slots are released immediately;
     * each runner still records its own outcome once its processor returns.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!isRunning.compareAndSet(true, false)) {
                return;
            }

            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }

            var signalled = 0;
            for (var signal : activeJobs.values()) {
                if (signal.cancel()) {
                    signalled++;
                }
            }
            activeJobs.clear();

            log.info("Import scheduler stopped, cancellation signalled to {} active jobs", signalled);
        }
    }

    /**
     * One poll tick: claim and launch at most one job.
     * Errors are logged and the next tick tries again.
     */
    public void pollCycle() {
        try {
            if (!isRunning.get()) {
                return;
            }

            if (activeJobs.size() >= properties.getConcurrentJobs()) {
                log.debug("All {} job slots busy, skipping poll", properties.getConcurrentJobs());
                return;
            }

            var currentProcessor = processor.get();
            if (currentProcessor == null) {
                log.warn("No import job processor registered, skipping poll");
                return;
            }

            // The claim runs outside the lock so a slow store never holds up stop()
            var claimed = claimService.claimNext();
            if (claimed.isEmpty()) {
                return;
            }

            var job = claimed.get();
            boolean launched;
            synchronized (lifecycleLock) {
                // stop() may have run while the claim was in flight
                launched = isRunning.get() && launch(job, currentProcessor);
            }
            if (!launched) {
                releaseClaim(job);
            }
        } catch (Exception e) {
            log.error("Error in import poll cycle: {}", e.getMessage(), e);
            metricsConfig.recordPollError(e.getClass().getSimpleName());
        }
    }

    private boolean launch(ImportJob job, ImportJobProcessor jobProcessor) {
        var jobId = job.getId();
        var signal = new CancellationSignal(jobId);
        activeJobs.put(jobId, signal);

        try {
            CompletableFuture.runAsync(() -> executorService.execute(job, jobProcessor, signal), importJobExecutor)
                    .whenComplete((result, ex) -> {
                        activeJobs.remove(jobId, signal);
                        if (ex != null) {
                            log.error("Runner for job {} terminated abnormally: {}", jobId, ex.getMessage(), ex);
                        }
                    });
            log.info("Launched job {} ({} active)", jobId, activeJobs.size());
            return true;
        } catch (RejectedExecutionException e) {
            activeJobs.remove(jobId, signal);
            log.error("Executor rejected job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Hand a claimed job that was never started back to the queue.
     */
    private void releaseClaim(ImportJob job) {
        var jobId = job.getId();
        if (jobStore.finalizeJob(jobId, ImportJobStatus.QUEUED, null)) {
            jobStore.appendLog(jobId, ImportJobLogLevel.WARN, "Job " + jobId + " could not be started and was requeued");
            log.warn("Released claim on job {}", jobId);
        }
    }

    /**
     * Requeue jobs left RUNNING by a process that died mid-job.
     * Disabled unless stale-job-threshold-minutes is positive.
     */
    @Scheduled(fixedDelayString = "${import-scheduler.stale-job-check-interval-ms:300000}")
    public void releaseStaleJobs() {
        var thresholdMinutes = properties.getStaleJobThresholdMinutes();
        if (thresholdMinutes <= 0) {
            return;
        }

        try {
            var threshold = Instant.now().minus(Duration.ofMinutes(thresholdMinutes));
            var staleJobs = jobStore.findStaleRunningJobs(threshold);

            var released = 0;
            for (var job : staleJobs) {
                if (activeJobs.containsKey(job.getId())) {
                    continue;
                }
                if (jobStore.finalizeJob(job.getId(), ImportJobStatus.QUEUED, null)) {
                    jobStore.appendLog(job.getId(), ImportJobLogLevel.WARN,
                            "Job " + job.getId() + " was running since " + job.getStartedAt() + " and has been requeued");
                    released++;
                }
            }

            if (released > 0) {
                log.warn("Requeued {} stale import jobs", released);
            }
        } catch (Exception e) {
            log.error("Error releasing stale import jobs: {}", e.getMessage(), e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    public int getActiveJobCount() {
        return activeJobs.size();
    }
}
