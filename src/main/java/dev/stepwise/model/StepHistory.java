package dev.stepwise.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the steps recorded so far in a run. Rules see this, never the graph itself.
 */
public interface StepHistory {

    /** Nodes in append order. */
    List<StepNode> nodes();

    int size();

    boolean contains(String id);

    Optional<StepNode> node(String id);

    Optional<StepNode> lastNode();
}
