package com.umitunal.leaseq.core;

/**
 * Thrown by a job to report how its execution failed.
 * A retryable failure is scheduled again while retries remain; a permanent one fails the job at once.
 */
public class JobException extends Exception {
    private final boolean retryable;

    private JobException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static JobException retryable(String reason) {
        return new JobException(reason, null, true);
    }

    public static JobException retryable(String reason, Throwable cause) {
        return new JobException(reason, cause, true);
    }

    public static JobException permanent(String reason) {
        return new JobException(reason, null, false);
    }

    public static JobException permanent(String reason, Throwable cause) {
        return new JobException(reason, cause, false);
    }

    public boolean isRetryable() { return retryable; }
    public boolean isPermanent() { return !retryable; }
}
