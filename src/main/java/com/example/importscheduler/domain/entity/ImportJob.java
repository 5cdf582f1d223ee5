package com.example.importscheduler.domain.entity;

import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One schedulable unit of import work.
 * <p>
 * Status is only ever changed through conditional updates in the repository:
 * - queued -> running by the claim
 * - running -> success / failed / queued by the runner holding the claim
 * <p>
 * Progress counters and the checkpoint belong to the processor; the scheduler
 * never interprets them.
 */
@Entity
@Table(name = "import_jobs", indexes = {
        @Index(name = "idx_import_job_status_created", columnList = "status, created_at"),
        @Index(name = "idx_import_job_source_id", columnList = "source_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * External data source this job imports from
     */
    @Column(name = "source_id", nullable = false, length = 100)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ImportJobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ImportJobStatus status;

    /**
     * Requester identity, audit only
     */
    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "total_items", nullable = false)
    @Builder.Default
    private Integer totalItems = 0;

    @Column(name = "processed_items", nullable = false)
    @Builder.Default
    private Integer processedItems = 0;

    /**
     * Failed execution attempts so far; drives the retry cap
     */
    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private Integer errorCount = 0;

    /**
     * Opaque resume token (cursor, page URL, timestamp) written by the processor
     */
    @Column(name = "last_checkpoint", length = 2000)
    private String lastCheckpoint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.status == null) {
            this.status = ImportJobStatus.QUEUED;
        }
        if (this.totalItems == null) {
            this.totalItems = 0;
        }
        if (this.processedItems == null) {
            this.processedItems = 0;
        }
        if (this.errorCount == null) {
            this.errorCount = 0;
        }
    }

    public boolean isFinished() {
        return status != null && status.isTerminal();
    }

    /**
     * Whether a previous attempt left a checkpoint to resume from
     */
    public boolean hasCheckpoint() {
        return lastCheckpoint != null && !lastCheckpoint.isBlank();
    }
}
