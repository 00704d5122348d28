package com.alertsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordinal alert severity.
 *
 * <p>
 * Declaration order defines the rank: {@code LOW < MEDIUM < HIGH < CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @return numeric rank, 0 for {@link #LOW} up to 3 for {@link #CRITICAL}
     */
    public int rank() {
        return ordinal();
    }

    /**
     * @param minimum the floor to compare against
     * @return {@code true} if this severity meets or exceeds {@code minimum}
     */
    public boolean meetsOrExceeds(Severity minimum) {
        return rank() >= minimum.rank();
    }

    /**
     * Lowercase name, as used in configuration files and outcomes.
     *
     * @return e.g. {@code "high"}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value raw value, may be {@code null}
     * @return the matching severity, or empty if blank or unknown
     */
    public static Optional<Severity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalised)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
