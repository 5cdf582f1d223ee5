package com.example.importscheduler.dto;

import com.example.importscheduler.domain.enums.ImportJobKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for enqueueing an import job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueImportJobRequest {

    @NotBlank(message = "Source ID is required")
    @Size(max = 100, message = "Source ID must be at most 100 characters")
    private String sourceId;

    @NotNull(message = "Kind is required")
    private ImportJobKind kind;

    /**
     * Who requested the import
     */
    @NotBlank(message = "Created by is required")
    @Size(max = 100, message = "Created by must be at most 100 characters")
    private String createdBy;
}
