package com.umitunal.leaseq.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque, immutable identifier assigned to a job at enqueue time.
 */
public final class JobId {
    private final String value;

    private JobId(String value) {
        this.value = value;
    }

    /**
     * Generate a new unique job id.
     */
    public static JobId random() {
        return new JobId(UUID.randomUUID().toString());
    }

    /**
     * Wrap an existing id string (e.g. one read back from storage).
     */
    public static JobId of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        return new JobId(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
