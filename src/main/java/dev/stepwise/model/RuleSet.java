package dev.stepwise.model;

import java.util.List;

/**
 * A named collection of rule definitions plus the engine limits they were written for.
 */
public record RuleSet(
    String id,
    String description,
    EngineConfig engine,
    List<RuleDefinition> rules
) {}
