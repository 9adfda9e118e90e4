package dev.stepwise.engine;

import dev.stepwise.model.RuleDefinition;
import dev.stepwise.model.RuleMatch;
import dev.stepwise.model.RuleSet;
import dev.stepwise.provider.TextExpressionProvider;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates rule sets before their rules are registered.
 */
public final class RuleSetValidator {

    private RuleSetValidator() {}

    /**
     * Validate against the operations of the bundled text provider.
     */
    public static List<String> validate(RuleSet ruleSet) {
        return validate(ruleSet, TextExpressionProvider.OPERATIONS);
    }

    /**
     * Validate a rule set. Returns an empty list if valid, or a list of error messages if
     * invalid.
     *
     * @param supportedTransforms provider operations a rule may name as its transform
     */
    public static List<String> validate(RuleSet ruleSet, Set<String> supportedTransforms) {
        var errors = new ArrayList<String>();

        if (ruleSet.id() == null || ruleSet.id().isBlank()) {
            errors.add("Rule set has missing or empty id");
        }
        if (ruleSet.rules().isEmpty()) {
            errors.add("Rule set '%s' defines no rules".formatted(ruleSet.id()));
        }

        var seen = new HashSet<String>();
        for (RuleDefinition rule : ruleSet.rules()) {
            String name = rule.name();

            if (name == null || name.isBlank()) {
                errors.add("Rule has missing or empty name");
                continue;
            }
            if (rule.operation() == null || rule.operation().isBlank()) {
                errors.add("Rule '%s' has missing or empty operation".formatted(name));
            } else if (!seen.add(rule.operation() + "/" + name)) {
                errors.add("Rule '%s' is defined twice for operation '%s'".formatted(name, rule.operation()));
            }

            if (rule.domains().isEmpty()) {
                errors.add("Rule '%s' has no domains".formatted(name));
            }

            validateMatch(rule, errors);

            if (!supportedTransforms.contains(rule.transform())) {
                errors.add("Rule '%s': unknown transform '%s'. Supported: %s"
                    .formatted(name, rule.transform(), supportedTransforms));
            } else {
                validateParams(rule, errors);
            }

            if (rule.explanation().concise().isBlank()) {
                errors.add("Rule '%s' has an empty concise explanation".formatted(name));
            }
        }

        return errors;
    }

    private static void validateMatch(RuleDefinition rule, List<String> errors) {
        RuleMatch match = rule.match();
        if (match instanceof RuleMatch.Equals eq && eq.value().isEmpty()) {
            errors.add("Rule '%s': equals match is empty".formatted(rule.name()));
        } else if (match instanceof RuleMatch.Contains contains && contains.value().isEmpty()) {
            // an empty substring would match every expression
            errors.add("Rule '%s': contains match is empty".formatted(rule.name()));
        } else if (match instanceof RuleMatch.Regex regex) {
            checkPattern(rule.name(), "match", regex.pattern(), errors);
        }
    }

    private static void validateParams(RuleDefinition rule, List<String> errors) {
        switch (rule.transform()) {
            case TextExpressionProvider.OP_REPLACE, TextExpressionProvider.OP_REPLACE_ALL -> {
                String target = rule.params().get("target");
                if (target == null || target.isEmpty()) {
                    errors.add("Rule '%s': transform '%s' needs a 'target'".formatted(rule.name(), rule.transform()));
                }
            }
            case TextExpressionProvider.OP_REGEX_REPLACE -> {
                String pattern = rule.params().get("pattern");
                if (pattern == null || pattern.isEmpty()) {
                    errors.add("Rule '%s': transform '%s' needs a 'pattern'".formatted(rule.name(), rule.transform()));
                } else {
                    checkPattern(rule.name(), "transform", pattern, errors);
                }
            }
            default -> {
                // supported by a provider other than the text provider; nothing to check here
            }
        }
    }

    private static void checkPattern(String rule, String where, String pattern, List<String> errors) {
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            errors.add("Rule '%s': invalid %s pattern '%s': %s".formatted(rule, where, pattern, e.getDescription()));
        }
    }
}
