package com.example.importscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of an import job.
 * <p>
 * queued -> running -> success | failed, with running -> queued on a retryable failure.
 */
@Getter
@RequiredArgsConstructor
public enum ImportJobStatus {

    /**
     * Waiting to be claimed by a scheduler instance.
     * Initial state for all new jobs and the state a retried job returns to.
     */
    QUEUED("queued", "Queued"),

    /**
     * Claimed by exactly one scheduler instance and handed to the processor.
     */
    RUNNING("running", "Running"),

    /**
     * Processor completed without error. Terminal.
     */
    SUCCESS("success", "Success"),

    /**
     * Retries exhausted or the job was cancelled. Terminal.
     */
    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    public static ImportJobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown import job status code: " + code);
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Only queued jobs are candidates for a claim
     */
    public boolean isClaimable() {
        return this == QUEUED;
    }
}
