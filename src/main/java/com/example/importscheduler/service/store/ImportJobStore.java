package com.example.importscheduler.service.store;

import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.entity.ImportJobError;
import com.example.importscheduler.domain.entity.ImportJobLog;
import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage of jobs, job logs and job errors.
 * <p>
 * Implementations must make {@link #conditionalClaim(UUID)} and
 * {@link #finalizeJob(UUID, ImportJobStatus, Instant)} single-row compare-and-set
 * operations on the job status; they are the only mutual exclusion between
 * scheduler instances sharing a store. Infrastructure failures surface as
 * unchecked exceptions.
 */
public interface ImportJobStore {

    /**
     * Oldest queued job by creation time, if any. Not atomic with the claim.
     */
    Optional<ImportJob> selectOldestQueued();

    /**
     * Set the job to RUNNING with startedAt = now, but only if it is still QUEUED.
     *
     * @return the claimed job, or empty if it was no longer queued
     */
    Optional<ImportJob> conditionalClaim(UUID jobId);

    /**
     * Move a RUNNING job to its next status. A null finishedAt clears the column.
     *
     * @return false if the job was no longer RUNNING and nothing was written
     */
    boolean finalizeJob(UUID jobId, ImportJobStatus status, Instant finishedAt);

    /**
     * Increment the persisted error count and return the new value read back from storage
     */
    int incrementErrorCount(UUID jobId);

    void appendLog(UUID jobId, ImportJobLogLevel level, String message, Map<String, Object> details);

    default void appendLog(UUID jobId, ImportJobLogLevel level, String message) {
        appendLog(jobId, level, message, null);
    }

    ImportJobError appendError(UUID jobId, String stage, String errorMessage, String errorCode, String externalId);

    /**
     * @return false if the job does not exist
     */
    boolean updateProgress(UUID jobId, int processedItems, int totalItems);

    /**
     * @return false if the job does not exist
     */
    boolean updateCheckpoint(UUID jobId, String checkpoint);

    ImportJob insertJob(String sourceId, ImportJobKind kind, String createdBy);

    Optional<ImportJob> getJob(UUID jobId);

    List<ImportJobLog> getLogs(UUID jobId);

    Page<ImportJobLog> getLogs(UUID jobId, Pageable pageable);

    List<ImportJobError> getErrors(UUID jobId);

    Optional<ImportJobError> resolveError(Long errorId);

    List<ImportJob> getJobsForSource(String sourceId);

    long countByStatus(ImportJobStatus status);

    /**
     * Running jobs whose claim is older than the threshold
     */
    List<ImportJob> findStaleRunningJobs(Instant threshold);
}
