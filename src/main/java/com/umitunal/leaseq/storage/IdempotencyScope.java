package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.core.JobMessage;

import java.util.Objects;

/**
 * Scope in which an idempotency key is unique: tenant, queue, job type and key.
 *
 * <p>Components are compared as a tuple, so separator characters inside queue or job type names
 * cannot make two scopes collide.
 */
final class IdempotencyScope {
    private final String tenantId;
    private final String queue;
    private final String jobType;
    private final String key;

    private IdempotencyScope(String tenantId, String queue, String jobType, String key) {
        this.tenantId = tenantId;
        this.queue = queue;
        this.jobType = jobType;
        this.key = key;
    }

    static IdempotencyScope of(String tenantId, JobMessage message) {
        return new IdempotencyScope(tenantId, message.getQueue(), message.getJobType(),
                Objects.requireNonNull(message.getIdempotencyKey(), "idempotencyKey must not be null"));
    }

    /**
     * Storage key with every component length-prefixed: {@code <len>:<value>} per component.
     */
    String toKey() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{tenantId, queue, jobType, key}) {
            sb.append(part.length()).append(':').append(part);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdempotencyScope other)) return false;
        return tenantId.equals(other.tenantId)
                && queue.equals(other.queue)
                && jobType.equals(other.jobType)
                && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, queue, jobType, key);
    }

    @Override
    public String toString() {
        return String.format("IdempotencyScope{tenant='%s', queue='%s', type='%s', key='%s'}",
                tenantId, queue, jobType, key);
    }
}
