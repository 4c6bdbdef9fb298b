package com.umitunal.leaseq.core;

/**
 * Closed set of failures a queue operation can report.
 */
public enum QueueErrorKind {
    JOB_NOT_FOUND(Category.NOT_FOUND, false),
    INVALID_LEASE_TOKEN(Category.LEASE, false),
    LEASE_EXPIRED(Category.LEASE, false),
    JOB_CANCELED(Category.STATE_CONFLICT, false),
    JOB_ALREADY_TERMINAL(Category.STATE_CONFLICT, false),
    BACKEND_UNSUPPORTED(Category.CAPABILITY, false),
    SERIALIZATION_ERROR(Category.PAYLOAD, true),
    CODEC_NOT_FOUND(Category.PAYLOAD, true),
    PAYLOAD_TOO_LARGE(Category.PAYLOAD, true),
    JOB_TYPE_NOT_REGISTERED(Category.DISPATCH, true),
    WORKER_SHUTDOWN(Category.SHUTDOWN, false),
    INTERNAL(Category.INTERNAL, false);

    public enum Category {
        NOT_FOUND,
        LEASE,
        STATE_CONFLICT,
        CAPABILITY,
        PAYLOAD,
        DISPATCH,
        SHUTDOWN,
        INTERNAL
    }

    private final Category category;
    private final boolean permanentForJob;

    QueueErrorKind(Category category, boolean permanentForJob) {
        this.category = category;
        this.permanentForJob = permanentForJob;
    }

    public Category category() {
        return category;
    }

    /**
     * True when retrying the same job can never succeed (bad payload, unknown type).
     */
    public boolean isPermanentForJob() {
        return permanentForJob;
    }
}
