package dev.stepwise.render;

import dev.stepwise.model.StepNode;
import dev.stepwise.model.StepResult;
import dev.stepwise.model.Verbosity;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text step listing. Concise shows only the rewrites, detailed adds the rule name and
 * explanation, teacher adds the longest explanation and the step metadata.
 */
public final class TextStepRenderer implements StepRenderer {

    public static final String FORMAT = "text";

    @Override
    public String format() {
        return FORMAT;
    }

    @Override
    public String render(StepResult result, Verbosity verbosity) {
        List<String> lines = new ArrayList<>();
        lines.add("Operation: " + result.operation());
        lines.add("Input: " + result.input());
        lines.add("Output: " + result.output());
        lines.add("");

        if (result.graph().isEmpty()) {
            lines.add("(no steps)");
            return String.join("\n", lines);
        }

        lines.add("Steps:");
        for (StepNode node : result.graph().nodes()) {
            String explanation = node.explanation().forVerbosity(verbosity);
            switch (verbosity) {
                case CONCISE -> lines.add("- %s -> %s".formatted(node.input(), node.output()));
                case DETAILED -> {
                    lines.add("- [%s] %s -> %s".formatted(node.rule(), node.input(), node.output()));
                    lines.add("  " + explanation);
                }
                case TEACHER -> {
                    lines.add("- [%s] %s -> %s".formatted(node.rule(), node.input(), node.output()));
                    lines.add("  Explanation: " + explanation);
                    if (!node.metadata().isEmpty()) {
                        lines.add("  Notes: " + node.metadata());
                    }
                }
            }
        }

        return String.join("\n", lines);
    }
}
