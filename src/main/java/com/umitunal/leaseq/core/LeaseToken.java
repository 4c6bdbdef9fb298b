package com.umitunal.leaseq.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Proof of an exclusive claim on a leased job.
 * A fresh token is issued on every dequeue; acks and heartbeats must present it.
 */
public final class LeaseToken {
    private final String value;

    private LeaseToken(String value) {
        this.value = value;
    }

    public static LeaseToken random() {
        return new LeaseToken(UUID.randomUUID().toString());
    }

    public static LeaseToken of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new LeaseToken(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LeaseToken other)) return false;
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
