package dev.stepwise.model;

/**
 * Outcome of one engine run: the sealed graph plus the final expression. When no rule fired,
 * {@code output} is the input as rendered by the provider and the graph is empty.
 */
public record StepResult(
    String operation,
    String input,
    String output,
    StepGraph graph
) {}
