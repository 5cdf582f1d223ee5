package com.example.importscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for an unknown import job or job error record
 */
@Getter
public class ImportJobNotFoundException extends RuntimeException {

    private final String resourceId;

    public ImportJobNotFoundException(String resourceId) {
        super("Import job not found: " + resourceId);
        this.resourceId = resourceId;
    }

    public ImportJobNotFoundException(UUID jobId) {
        this(jobId.toString());
    }

    public ImportJobNotFoundException(String resourceType, Object resourceId) {
        super(String.format("%s not found: %s", resourceType, resourceId));
        this.resourceId = String.valueOf(resourceId);
    }
}
