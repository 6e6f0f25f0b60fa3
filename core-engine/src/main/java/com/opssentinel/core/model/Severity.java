package com.opssentinel.core.model;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity is the same as or worse than
     *         {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name such as {@code "critical"}
     * @return the matching severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high, critical", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
