package com.umitunal.leaseq.core;

import java.util.Locale;

/**
 * Job priority levels. Higher values are leased first.
 */
public enum JobPriority {

    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int value;

    JobPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static JobPriority fromValue(int value) {
        for (JobPriority priority : values()) {
            if (priority.value == value) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Invalid priority value: " + value);
    }

    /**
     * Parse a priority name, ignoring case ("high", "CRITICAL", ...).
     */
    public static JobPriority parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Invalid priority: " + name);
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid priority: " + name, e);
        }
    }
}
