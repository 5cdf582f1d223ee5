package com.example.importscheduler.exception;

import lombok.Getter;

/**
 * Thrown by a processor to attach a machine-readable code (and optionally the
 * failing item's external id) to the error record of a failed attempt.
 */
@Getter
public class ImportJobProcessingException extends RuntimeException {

    private final String errorCode;
    private final String externalId;

    public ImportJobProcessingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.externalId = null;
    }

    public ImportJobProcessingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.externalId = null;
    }

    public ImportJobProcessingException(String errorCode, String externalId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.externalId = externalId;
    }
}
