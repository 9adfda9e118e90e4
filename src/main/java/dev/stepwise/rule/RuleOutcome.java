package dev.stepwise.rule;

import dev.stepwise.model.Explanation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a rule hands back to the engine after firing.
 *
 * @param dependencies ids of earlier steps this one builds on; empty means "the previous step"
 */
public record RuleOutcome(
    String output,
    Explanation explanation,
    List<String> dependencies,
    Map<String, Object> metadata
) {
    public RuleOutcome {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(explanation, "explanation");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static RuleOutcome of(String output, String explanation) {
        return new RuleOutcome(output, Explanation.of(explanation), List.of(), Map.of());
    }
}
