package com.example.importscheduler.controller;

import com.example.importscheduler.dto.*;
import com.example.importscheduler.service.ImportJobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.web.PagedModel;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for import jobs.
 * <p>
 * Provides endpoints for:
 * - Enqueueing jobs
 * - Job status, logs and errors
 * - Resolving error records
 * - Starting and stopping the scheduler of this instance
 * - Statistics
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/import-jobs")
@Tag(name = "Import Jobs", description = "APIs for enqueueing and observing import jobs")
public class ImportJobController {

    static final int MAX_PAGE_SIZE = 200;

    private final ImportJobManagementService managementService;

    // === Enqueue ===

    @PostMapping
    @Operation(summary = "Enqueue an import job", description = "Queue an import job; it runs on a later poll tick")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ImportJobResponse>> enqueue(@Valid @RequestBody EnqueueImportJobRequest request) {
        log.info("API: Enqueue {} import for source {}", request.getKind(), request.getSourceId());

        var response = managementService.enqueue(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Import job queued"));
    }

    // === Job Retrieval ===

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Retrieve an import job by its identifier")
    public ResponseEntity<ApiResponse<ImportJobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return managementService.getStatus(jobId)
                .map(job -> ResponseEntity.ok(ApiResponse.success(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/source/{sourceId}")
    @Operation(summary = "Get jobs by source", description = "All import jobs of one source, newest first")
    public ResponseEntity<ApiResponse<List<ImportJobResponse>>> getJobsForSource(
            @Parameter(description = "Source ID") @PathVariable String sourceId) {

        return ResponseEntity.ok(ApiResponse.success(managementService.getJobsForSource(sourceId)));
    }

    @GetMapping("/{jobId}/logs")
    @Operation(summary = "Get job logs", description = "Log entries of a job in chronological order")
    public ResponseEntity<ApiResponse<PagedModel<ImportJobLogResponse>>> getLogs(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") @Min(0) int page,
            @Parameter(description = "Page size, at most " + MAX_PAGE_SIZE) @RequestParam(defaultValue = "50") @Min(1) @Max(MAX_PAGE_SIZE) int size) {

        var logs = managementService.getLogs(jobId, PageRequest.of(page, size));
        return ResponseEntity.ok(ApiResponse.success(new PagedModel<>(logs)));
    }

    @GetMapping("/{jobId}/errors")
    @Operation(summary = "Get job errors", description = "Error records of a job in chronological order")
    public ResponseEntity<ApiResponse<List<ImportJobErrorResponse>>> getErrors(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(managementService.getErrors(jobId)));
    }

    @PostMapping("/errors/{errorId}/resolve")
    @Operation(summary = "Resolve an error", description = "Mark an error record as handled")
    public ResponseEntity<ApiResponse<ImportJobErrorResponse>> resolveError(@Parameter(description = "Error ID") @PathVariable Long errorId) {
        log.info("API: Resolve error {}", errorId);

        var response = managementService.resolveError(errorId);
        return ResponseEntity.ok(ApiResponse.success(response, "Error resolved"));
    }

    // === Statistics ===

    @GetMapping("/statistics")
    @Operation(summary = "Get job statistics", description = "Job counts by status and local scheduler state")
    public ResponseEntity<ApiResponse<ImportJobStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(managementService.getStatistics()));
    }

    // === Scheduler Control ===

    @PostMapping("/scheduler/start")
    @Operation(summary = "Start the scheduler", description = "Start polling on this instance; no-op if already running")
    public ResponseEntity<ApiResponse<Void>> startScheduler() {
        log.info("API: Start scheduler");

        managementService.startScheduler();
        return ResponseEntity.ok(ApiResponse.success(null, "Scheduler started"));
    }

    @PostMapping("/scheduler/stop")
    @Operation(summary = "Stop the scheduler", description = "Stop polling on this instance and signal cancellation to its active jobs")
    public ResponseEntity<ApiResponse<Void>> stopScheduler() {
        log.info("API: Stop scheduler");

        managementService.stopScheduler();
        return ResponseEntity.ok(ApiResponse.success(null, "Scheduler stopped"));
    }
}
