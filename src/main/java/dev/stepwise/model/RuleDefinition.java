package dev.stepwise.model;

import java.util.Map;
import java.util.Set;

/**
 * A rule described as data: when it applies, which provider operation it runs, and how the
 * step is explained.
 */
public record RuleDefinition(
    String name,
    String operation,
    int priority,
    Set<String> domains,
    RuleMatch match,
    String transform,
    Map<String, String> params,
    Explanation explanation
) {}
