package com.example.importscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised from a cancellation checkpoint inside a processor
 */
@Getter
public class ImportJobCancelledException extends RuntimeException {

    private final UUID jobId;

    public ImportJobCancelledException(UUID jobId) {
        super("Import job " + jobId + " was cancelled");
        this.jobId = jobId;
    }
}
