package com.example.importscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobStatistics {

    private Map<String, Long> statusDistribution;
    private long queuedCount;
    private long runningCount;
    private long successCount;
    private long failedCount;

    /**
     * Jobs executing in the answering process only
     */
    private int activeJobs;
    private boolean schedulerRunning;
    private Instant generatedAt;
}
