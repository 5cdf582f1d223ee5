package com.example.importscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobErrorResponse {

    private Long id;
    private UUID jobId;
    private String stage;
    private String errorMessage;
    private String errorCode;
    private String externalId;
    private Integer retryCount;
    private Boolean resolved;
    private Instant createdAt;
}
