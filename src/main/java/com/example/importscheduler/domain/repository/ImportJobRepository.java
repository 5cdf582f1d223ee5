package com.example.importscheduler.domain.repository;

import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ImportJob entity.
 * <p>
 * Every status change is a single-row conditional UPDATE that names the status
 * it expects to find. A return value of 0 means another writer got there first;
 * no row locks are held between the read of a candidate and its claim.
 */
@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, UUID> {

    /**
     * Oldest job in the given status. Used to pick a claim candidate (FIFO by creation time).
     */
    Optional<ImportJob> findFirstByStatusOrderByCreatedAtAsc(ImportJobStatus status);

    /**
     * Claim a queued job.
     *
     * @return number of rows updated (1 if this caller won the claim, 0 if the job was no longer queued)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ImportJob j
            SET j.status = :running,
                j.startedAt = :now,
                j.finishedAt = NULL
            WHERE j.id = :jobId
              AND j.status = :queued
            """)
    int claimJob(
            @Param("jobId") UUID jobId,
            @Param("queued") ImportJobStatus queued,
            @Param("running") ImportJobStatus running,
            @Param("now") Instant now);

    /**
     * Move a job from an expected status to a new one.
     * Passing a null finishedAt clears the column (used when requeuing).
     *
     * @return number of rows updated (0 if the job was not in the expected status)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ImportJob j
            SET j.status = :newStatus,
                j.finishedAt = :finishedAt
            WHERE j.id = :jobId
              AND j.status = :expectedStatus
            """)
    int transitionStatus(
            @Param("jobId") UUID jobId,
            @Param("expectedStatus") ImportJobStatus expectedStatus,
            @Param("newStatus") ImportJobStatus newStatus,
            @Param("finishedAt") Instant finishedAt);

    /**
     * Increment the persisted error counter in place
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ImportJob j SET j.errorCount = j.errorCount + 1 WHERE j.id = :jobId")
    int incrementErrorCount(@Param("jobId") UUID jobId);

    /**
     * Read the error counter straight from the table, bypassing any managed entity
     */
    @Query("SELECT j.errorCount FROM ImportJob j WHERE j.id = :jobId")
    Optional<Integer> findErrorCountById(@Param("jobId") UUID jobId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ImportJob j
            SET j.processedItems = :processedItems,
                j.totalItems = :totalItems
            WHERE j.id = :jobId
            """)
    int updateProgress(
            @Param("jobId") UUID jobId,
            @Param("processedItems") int processedItems,
            @Param("totalItems") int totalItems);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ImportJob j SET j.lastCheckpoint = :checkpoint WHERE j.id = :jobId")
    int updateCheckpoint(@Param("jobId") UUID jobId, @Param("checkpoint") String checkpoint);

    /**
     * Running jobs claimed before the threshold. Candidates for stale-job recovery.
     */
    List<ImportJob> findByStatusAndStartedAtBefore(ImportJobStatus status, Instant threshold);

    long countByStatus(ImportJobStatus status);

    List<ImportJob> findBySourceIdOrderByCreatedAtDesc(String sourceId);
}
