package com.umitunal.leaseq.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static feature flags of a backend. Calling an unsupported operation fails with
 * {@link QueueErrorKind#BACKEND_UNSUPPORTED}.
 */
public final class QueueCapabilities {

    public enum Capability {
        DELAYED,
        SCHEDULED_AT,
        CANCEL,
        LEASE_EXTEND,
        PRIORITY,
        IDEMPOTENCY,
        DEAD_LETTER_QUEUE
    }

    private final Set<Capability> supported;

    private QueueCapabilities(Set<Capability> supported) {
        this.supported = Collections.unmodifiableSet(supported);
    }

    public static QueueCapabilities of(Capability first, Capability... rest) {
        return new QueueCapabilities(EnumSet.of(first, rest));
    }

    public static QueueCapabilities all() {
        return new QueueCapabilities(EnumSet.allOf(Capability.class));
    }

    /**
     * Nothing beyond enqueue, dequeue and acknowledgements.
     */
    public static QueueCapabilities minimal() {
        return new QueueCapabilities(EnumSet.noneOf(Capability.class));
    }

    public QueueCapabilities without(Capability capability) {
        EnumSet<Capability> copy = supported.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(supported);
        copy.remove(capability);
        return new QueueCapabilities(copy);
    }

    public boolean supports(Capability capability) {
        return supported.contains(capability);
    }

    public Set<Capability> supportedFeatures() {
        return supported;
    }

    public boolean isDelayed() { return supports(Capability.DELAYED); }
    public boolean isScheduledAt() { return supports(Capability.SCHEDULED_AT); }
    public boolean isCancel() { return supports(Capability.CANCEL); }
    public boolean isLeaseExtend() { return supports(Capability.LEASE_EXTEND); }
    public boolean isPriority() { return supports(Capability.PRIORITY); }
    public boolean isIdempotency() { return supports(Capability.IDEMPOTENCY); }
    public boolean isDeadLetterQueue() { return supports(Capability.DEAD_LETTER_QUEUE); }

    @Override
    public String toString() {
        return "QueueCapabilities" + supported;
    }
}
