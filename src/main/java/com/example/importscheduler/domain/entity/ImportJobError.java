package com.example.importscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Structured failure record for operator triage.
 * <p>
 * Written by the runner for whole-attempt failures (stage "process") and by
 * processors for item-level failures, where {@code externalId} names the item.
 */
@Entity
@Table(name = "import_job_errors", indexes = {
        @Index(name = "idx_import_job_error_job_created", columnList = "job_id, created_at"),
        @Index(name = "idx_import_job_error_resolved", columnList = "resolved")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportJobError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    /**
     * Free-form tag for where the failure happened (process, fetch, transform, persist, ...)
     */
    @Column(name = "stage", nullable = false, length = 50)
    private String stage;

    @Column(name = "error_message", nullable = false, length = 4000)
    private String errorMessage;

    @Column(name = "error_code", length = 100)
    private String errorCode;

    /**
     * Identifier of the source item that failed, if the failure is item-level
     */
    @Column(name = "external_id", length = 200)
    private String externalId;

    /**
     * Job error count at the time the record was written
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "resolved", nullable = false)
    @Builder.Default
    private Boolean resolved = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.resolved == null) {
            this.resolved = false;
        }
    }
}
