package com.example.importscheduler.service.store;

import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.entity.ImportJobError;
import com.example.importscheduler.domain.entity.ImportJobLog;
import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.domain.repository.ImportJobErrorRepository;
import com.example.importscheduler.domain.repository.ImportJobLogRepository;
import com.example.importscheduler.domain.repository.ImportJobRepository;
import com.example.importscheduler.exception.ImportJobNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational job store on Spring Data JPA.
 * <p>
 * Each method runs in its own short transaction. Status changes go through the
 * conditional UPDATE statements of {@link ImportJobRepository}; nothing here
 * holds a row lock across calls.
 */
@Component
@RequiredArgsConstructor
public class JpaImportJobStore implements ImportJobStore {

    private static final int MAX_MESSAGE_LENGTH = 2000;
    private static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private final ImportJobRepository jobRepository;
    private final ImportJobLogRepository logRepository;
    private final ImportJobErrorRepository errorRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ImportJob> selectOldestQueued() {
        return jobRepository.findFirstByStatusOrderByCreatedAtAsc(ImportJobStatus.QUEUED);
    }

    @Override
    @Transactional
    public Optional<ImportJob> conditionalClaim(UUID jobId) {
        var updated = jobRepository.claimJob(jobId, ImportJobStatus.QUEUED, ImportJobStatus.RUNNING, Instant.now());

        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public boolean finalizeJob(UUID jobId, ImportJobStatus status, Instant finishedAt) {
        var updated = jobRepository.transitionStatus(jobId, ImportJobStatus.RUNNING, status, finishedAt);
        return updated == 1;
    }

    @Override
    @Transactional
    public int incrementErrorCount(UUID jobId) {
        if (jobRepository.incrementErrorCount(jobId) == 0) {
            throw new ImportJobNotFoundException(jobId);
        }
        return jobRepository.findErrorCountById(jobId).orElseThrow(() -> new ImportJobNotFoundException(jobId));
    }

    @Override
    @Transactional
    public void appendLog(UUID jobId, ImportJobLogLevel level, String message, Map<String, Object> details) {
        var entry = ImportJobLog.builder()
                .jobId(jobId)
                .level(level)
                .message(truncate(message, MAX_MESSAGE_LENGTH))
                .details(details)
                .build();

        logRepository.save(entry);
    }

    @Override
    @Transactional
    public ImportJobError appendError(UUID jobId, String stage, String errorMessage, String errorCode, String externalId) {
        var retryCount = jobRepository.findErrorCountById(jobId).orElse(0);

        var error = ImportJobError.builder()
                .jobId(jobId)
                .stage(stage)
                .errorMessage(truncate(errorMessage != null ? errorMessage : "Unknown error", MAX_ERROR_MESSAGE_LENGTH))
                .errorCode(errorCode)
                .externalId(externalId)
                .retryCount(retryCount)
                .resolved(false)
                .build();

        return errorRepository.save(error);
    }

    @Override
    @Transactional
    public boolean updateProgress(UUID jobId, int processedItems, int totalItems) {
        return jobRepository.updateProgress(jobId, processedItems, totalItems) == 1;
    }

    @Override
    @Transactional
    public boolean updateCheckpoint(UUID jobId, String checkpoint) {
        return jobRepository.updateCheckpoint(jobId, checkpoint) == 1;
    }

    @Override
    @Transactional
    public ImportJob insertJob(String sourceId, ImportJobKind kind, String createdBy) {
        var job = ImportJob.builder()
                .sourceId(sourceId)
                .kind(kind)
                .status(ImportJobStatus.QUEUED)
                .createdBy(createdBy)
                .totalItems(0)
                .processedItems(0)
                .errorCount(0)
                .build();

        return jobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ImportJob> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ImportJobLog> getLogs(UUID jobId) {
        return logRepository.findByJobIdOrderByCreatedAtAscIdAsc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ImportJobLog> getLogs(UUID jobId, Pageable pageable) {
        return logRepository.findByJobIdOrderByCreatedAtAscIdAsc(jobId, pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ImportJobError> getErrors(UUID jobId) {
        return errorRepository.findByJobIdOrderByCreatedAtAscIdAsc(jobId);
    }

    @Override
    @Transactional
    public Optional<ImportJobError> resolveError(Long errorId) {
        if (errorRepository.markResolved(errorId) == 0) {
            return Optional.empty();
        }
        return errorRepository.findById(errorId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ImportJob> getJobsForSource(String sourceId) {
        return jobRepository.findBySourceIdOrderByCreatedAtDesc(sourceId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(ImportJobStatus status) {
        return jobRepository.countByStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ImportJob> findStaleRunningJobs(Instant threshold) {
        return jobRepository.findByStatusAndStartedAtBefore(ImportJobStatus.RUNNING, threshold);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
