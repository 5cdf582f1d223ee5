package com.example.importscheduler.dto;

import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobLogResponse {

    private Long id;
    private UUID jobId;
    private ImportJobLogLevel level;
    private String message;
    private Map<String, Object> details;
    private Instant createdAt;
}
