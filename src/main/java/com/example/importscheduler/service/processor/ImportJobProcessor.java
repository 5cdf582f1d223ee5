package com.example.importscheduler.service.processor;

import com.example.importscheduler.domain.entity.ImportJob;

/**
 * Performs the actual import work for one claimed job.
 * <p>
 * Supplied by the embedding application. Implementations:
 * - run at most once per claim and have exclusive use of their own job
 * - may run concurrently with other processors on different jobs
 * - should check the cancellation signal at safe points
 * - report progress and checkpoints through the management service while running
 * - resume from {@link ImportJob#getLastCheckpoint()} when it is set
 * <p>
 * Returning normally means success; throwing means the attempt failed.
 * Throw {@link com.example.importscheduler.exception.ImportJobProcessingException}
 * to record an error code with the failure.
 */
@FunctionalInterface
public interface ImportJobProcessor {

    /**
     * Process one job
     *
     * @param job    the claimed job, already in RUNNING state
     * @param signal raised when the scheduler is asked to stop
     * @throws Exception if the attempt failed
     */
    void process(ImportJob job, CancellationSignal signal) throws Exception;
}
