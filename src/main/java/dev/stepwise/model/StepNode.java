package dev.stepwise.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded rule application. Collections are copied on construction, so a node cannot
 * change after it has been built.
 */
public record StepNode(
    String id,
    String operation,
    String rule,
    String input,
    String output,
    Explanation explanation,
    List<String> dependencies,
    Map<String, Object> metadata
) {
    public StepNode {
        requireText(id, "id");
        requireText(operation, "operation");
        requireText(rule, "rule");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(explanation, "explanation");
        dependencies = dependencies == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(dependencies));
        // insertion order is kept so renderers see a stable key order
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StepNode." + field + " must be non-empty");
        }
    }
}
