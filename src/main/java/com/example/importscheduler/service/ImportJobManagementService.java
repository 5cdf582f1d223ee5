package com.example.importscheduler.service;

import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.dto.EnqueueImportJobRequest;
import com.example.importscheduler.dto.ImportJobErrorResponse;
import com.example.importscheduler.dto.ImportJobLogResponse;
import com.example.importscheduler.dto.ImportJobResponse;
import com.example.importscheduler.dto.ImportJobStatistics;
import com.example.importscheduler.exception.ImportJobNotFoundException;
import com.example.importscheduler.mapper.ImportJobMapper;
import com.example.importscheduler.service.executor.ImportJobPollingService;
import com.example.importscheduler.service.store.ImportJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for import job lifecycle operations.
 * <p>
 * Provides:
 * - Enqueueing jobs
 * - Status, log and error queries
 * - Progress and checkpoint writes for processors
 * - Error triage
 * - Starting and stopping the local scheduler
 * - Statistics
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportJobManagementService {

    private final ImportJobStore jobStore;
    private final ImportJobPollingService pollingService;
    private final ImportJobMapper jobMapper;

    // === Enqueue ===

    /**
     * Insert a queued job. It is picked up on a later poll tick, never synchronously.
     */
    public ImportJobResponse enqueue(String sourceId, ImportJobKind kind, String createdBy) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("Source ID is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Kind is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("Created by is required");
        }

        var job = jobStore.insertJob(sourceId, kind, createdBy);
        jobStore.appendLog(job.getId(), ImportJobLogLevel.INFO,
                "Job enqueued: " + kind.getCode() + " import from source " + sourceId);

        log.info("Enqueued {} import job {} for source {} (by {})", kind.getCode(), job.getId(), sourceId, createdBy);
        return jobMapper.toResponse(job);
    }

    public ImportJobResponse enqueue(EnqueueImportJobRequest request) {
        return enqueue(request.getSourceId(), request.getKind(), request.getCreatedBy());
    }

    // === Queries ===

    public Optional<ImportJobResponse> getStatus(UUID jobId) {
        return jobStore.getJob(jobId).map(jobMapper::toResponse);
    }

    public List<ImportJobResponse> getJobsForSource(String sourceId) {
        return jobMapper.toResponseList(jobStore.getJobsForSource(sourceId));
    }

    /**
     * All log entries of a job, oldest first
     */
    public List<ImportJobLogResponse> getLogs(UUID jobId) {
        return jobMapper.toLogResponses(jobStore.getLogs(jobId));
    }

    public Page<ImportJobLogResponse> getLogs(UUID jobId, Pageable pageable) {
        return jobStore.getLogs(jobId, pageable).map(jobMapper::toLogResponse);
    }

    public List<ImportJobErrorResponse> getErrors(UUID jobId) {
        return jobMapper.toErrorResponses(jobStore.getErrors(jobId));
    }

    // === Processor-side writes ===

    public void updateProgress(UUID jobId, int processedItems, int totalItems) {
        if (processedItems < 0 || totalItems < 0) {
            throw new IllegalArgumentException("Progress counters must not be negative");
        }
        if (!jobStore.updateProgress(jobId, processedItems, totalItems)) {
            throw new ImportJobNotFoundException(jobId);
        }
    }

    public void updateCheckpoint(UUID jobId, String checkpoint) {
        if (!jobStore.updateCheckpoint(jobId, checkpoint)) {
            throw new ImportJobNotFoundException(jobId);
        }
    }

    // === Error triage ===

    public ImportJobErrorResponse resolveError(Long errorId) {
        var error = jobStore.resolveError(errorId)
                .orElseThrow(() -> new ImportJobNotFoundException("Import job error", errorId));

        log.info("Resolved error {} of job {}", errorId, error.getJobId());
        return jobMapper.toErrorResponse(error);
    }

    // === Scheduler control ===

    public void startScheduler() {
        pollingService.start();
    }

    public void stopScheduler() {
        pollingService.stop();
    }

    // === Statistics ===

    public ImportJobStatistics getStatistics() {
        var distribution = new LinkedHashMap<String, Long>();
        for (var status : ImportJobStatus.values()) {
            distribution.put(status.name(), jobStore.countByStatus(status));
        }

        return ImportJobStatistics.builder()
                .statusDistribution(distribution)
                .queuedCount(distribution.get(ImportJobStatus.QUEUED.name()))
                .runningCount(distribution.get(ImportJobStatus.RUNNING.name()))
                .successCount(distribution.get(ImportJobStatus.SUCCESS.name()))
                .failedCount(distribution.get(ImportJobStatus.FAILED.name()))
                .activeJobs(pollingService.getActiveJobCount())
                .schedulerRunning(pollingService.isRunning())
                .generatedAt(Instant.now())
                .build();
    }
}
