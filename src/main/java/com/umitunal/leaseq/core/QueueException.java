package com.umitunal.leaseq.core;

import java.util.Objects;

/**
 * Checked failure of a queue, codec or worker operation.
 */
public class QueueException extends Exception {
    private final QueueErrorKind kind;

    public QueueException(QueueErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public QueueException(QueueErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public QueueErrorKind getKind() { return kind; }

    public boolean is(QueueErrorKind other) {
        return kind == other;
    }

    public static QueueException jobNotFound(JobId jobId) {
        return new QueueException(QueueErrorKind.JOB_NOT_FOUND, "Job not found: " + jobId);
    }

    public static QueueException invalidLeaseToken(JobId jobId) {
        return new QueueException(QueueErrorKind.INVALID_LEASE_TOKEN, "Invalid lease token for job: " + jobId);
    }

    public static QueueException leaseExpired(JobId jobId) {
        return new QueueException(QueueErrorKind.LEASE_EXPIRED, "Lease expired for job: " + jobId);
    }

    public static QueueException jobCanceled(JobId jobId) {
        return new QueueException(QueueErrorKind.JOB_CANCELED, "Job was canceled: " + jobId);
    }

    public static QueueException alreadyTerminal(JobId jobId, JobStatus status) {
        return new QueueException(QueueErrorKind.JOB_ALREADY_TERMINAL,
                "Job " + jobId + " is already " + status);
    }

    public static QueueException unsupported(String operation) {
        return new QueueException(QueueErrorKind.BACKEND_UNSUPPORTED, "Backend does not support " + operation);
    }

    public static QueueException serialization(String message, Throwable cause) {
        return new QueueException(QueueErrorKind.SERIALIZATION_ERROR, message, cause);
    }

    public static QueueException codecNotFound(String codecId) {
        return new QueueException(QueueErrorKind.CODEC_NOT_FOUND, "No codec registered with id: " + codecId);
    }

    public static QueueException payloadTooLarge(int size, int limit) {
        return new QueueException(QueueErrorKind.PAYLOAD_TOO_LARGE,
                "Payload of " + size + " bytes exceeds limit of " + limit + " bytes");
    }

    public static QueueException jobTypeNotRegistered(String jobType) {
        return new QueueException(QueueErrorKind.JOB_TYPE_NOT_REGISTERED, "No job registered for type: " + jobType);
    }

    public static QueueException workerShutdown(String workerId) {
        return new QueueException(QueueErrorKind.WORKER_SHUTDOWN, "Worker " + workerId + " is shut down");
    }

    public static QueueException internal(String message, Throwable cause) {
        return new QueueException(QueueErrorKind.INTERNAL, message, cause);
    }
}
