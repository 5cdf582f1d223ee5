package com.example.importscheduler.dto;

import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for import job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobResponse {

    private UUID id;
    private String sourceId;
    private ImportJobKind kind;
    private ImportJobStatus status;
    private String createdBy;
    private Integer totalItems;
    private Integer processedItems;
    private Integer errorCount;
    private String lastCheckpoint;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
}
