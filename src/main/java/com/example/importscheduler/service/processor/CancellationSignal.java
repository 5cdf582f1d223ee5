package com.example.importscheduler.service.processor;

import com.example.importscheduler.exception.ImportJobCancelledException;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed to a processor together with its job.
 * <p>
 * The scheduler only raises the flag. A processor is expected to check it at
 * safe points (between pages, between items) and return or unwind; nothing
 * interrupts a processor that never looks.
 */
public final class CancellationSignal {

    private final UUID jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationSignal(UUID jobId) {
        this.jobId = jobId;
    }

    /**
     * Raise the flag.
     *
     * @return true if this call raised it, false if it was already raised
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Convenience checkpoint for processors that prefer to unwind by exception
     *
     * @throws ImportJobCancelledException if the flag is raised
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ImportJobCancelledException(jobId);
        }
    }

    public UUID getJobId() {
        return jobId;
    }
}
