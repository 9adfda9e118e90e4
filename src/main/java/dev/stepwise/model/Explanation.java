package dev.stepwise.model;

import java.util.Objects;

/**
 * Human-readable description of one step, in up to three verbosity variants.
 */
public record Explanation(
    String concise,
    String detailed, // nullable
    String teacher   // nullable
) {
    public Explanation {
        Objects.requireNonNull(concise, "concise explanation");
    }

    public static Explanation of(String concise) {
        return new Explanation(concise, null, null);
    }

    /**
     * Pick the variant for a verbosity level, falling back to the next shorter one.
     */
    public String forVerbosity(Verbosity verbosity) {
        return switch (verbosity) {
            case TEACHER -> teacher != null ? teacher : detailed != null ? detailed : concise;
            case DETAILED -> detailed != null ? detailed : concise;
            case CONCISE -> concise;
        };
    }
}
