package dev.stepwise.rule;

import dev.stepwise.model.StepHistory;

/**
 * Per-run facts a rule may read while applying. None of it changes during a call.
 */
public record RuleContext(
    String operation,
    String variable,
    StepHistory history
) {}
