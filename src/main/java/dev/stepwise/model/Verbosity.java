package dev.stepwise.model;

import java.util.Locale;

/**
 * How much explanation a renderer shows per step.
 */
public enum Verbosity {
    CONCISE,
    DETAILED,
    TEACHER;

    /** Case-insensitive lookup of {@code concise}, {@code detailed} or {@code teacher}. */
    public static Verbosity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Verbosity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown verbosity '%s'. Valid values: concise, detailed, teacher".formatted(value), e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
