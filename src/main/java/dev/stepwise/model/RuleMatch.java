package dev.stepwise.model;

/**
 * When a declarative rule applies. Exactly one of three forms: whole-expression equality,
 * substring containment, or a regular expression found anywhere in the expression.
 */
public sealed interface RuleMatch {

    /** Applies only when the expression is exactly this text. */
    record Equals(String value) implements RuleMatch {}

    /** Applies when the expression contains this text. */
    record Contains(String value) implements RuleMatch {}

    /** Applies when this pattern is found in the expression. */
    record Regex(String pattern) implements RuleMatch {}
}
