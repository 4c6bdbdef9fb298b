package com.umitunal.leaseq.job;

import com.umitunal.leaseq.core.JobException;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobPriority;

import java.time.Duration;
import java.util.Optional;

/**
 * A unit of work a worker can execute.
 *
 * <p>{@link #jobType()} is the dispatch key stored in each {@link JobMessage}; the defaults below
 * are applied when a producer submits through the client without overriding them.
 *
 * @param <P> payload type
 * @param <R> result type, {@link Void} when the job returns nothing
 */
public interface Job<P, R> {

    String jobType();

    Class<P> payloadType();

    default JobPriority priority() {
        return JobPriority.NORMAL;
    }

    default int maxRetries() {
        return JobMessage.DEFAULT_MAX_RETRIES;
    }

    /**
     * Execution timeout; empty uses the worker's default.
     */
    default Optional<Duration> timeout() {
        return Optional.empty();
    }

    /**
     * Run the job.
     *
     * @throws JobException to report a retryable or permanent failure
     */
    R execute(P payload, JobContext context) throws JobException;
}
