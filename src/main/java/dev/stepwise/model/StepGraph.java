package dev.stepwise.model;

import dev.stepwise.engine.GraphValidator;
import dev.stepwise.error.DependencyException;
import dev.stepwise.error.DuplicateIdException;
import dev.stepwise.error.GraphSealedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only, ordered record of every step of one computation. Owned by the run that creates
 * it until {@link #seal()} is called; after that it is read-only.
 */
public final class StepGraph implements StepHistory {

    private final List<StepNode> nodes = new ArrayList<>();
    private final Map<String, StepNode> byId = new HashMap<>();
    private boolean sealed;

    public static StepGraph empty() {
        return new StepGraph();
    }

    /**
     * Append a node. Every dependency must already be present.
     *
     * @throws GraphSealedException if the graph has been sealed
     * @throws DuplicateIdException if a node with the same id exists
     * @throws DependencyException  if a dependency is not in the graph yet
     */
    public void append(StepNode node) {
        if (sealed) {
            throw new GraphSealedException(node.id());
        }
        if (byId.containsKey(node.id())) {
            throw new DuplicateIdException(node.id());
        }
        for (String dependency : node.dependencies()) {
            if (!byId.containsKey(dependency)) {
                throw new DependencyException(node.id(), dependency);
            }
        }
        nodes.add(node);
        byId.put(node.id(), node);
    }

    /**
     * Validate the whole graph and make it immutable. Sealing twice is a no-op.
     */
    public void seal() {
        if (sealed) {
            return;
        }
        GraphValidator.validate(this);
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    @Override
    public List<StepNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    @Override
    public Optional<StepNode> node(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<StepNode> lastNode() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(nodes.size() - 1));
    }

    /** Read-only view handed to rules; it cannot be cast back to the graph. */
    public StepHistory view() {
        return new ReadOnlyView(this);
    }

    /** Output of the last node, or empty if nothing fired. */
    public Optional<String> finalOutput() {
        return lastNode().map(StepNode::output);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepGraph other)) return false;
        return nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "StepGraph[size=%d, sealed=%s]".formatted(nodes.size(), sealed);
    }

    private static final class ReadOnlyView implements StepHistory {
        private final StepGraph graph;

        ReadOnlyView(StepGraph graph) {
            this.graph = graph;
        }

        @Override
        public List<StepNode> nodes() {
            return graph.nodes();
        }

        @Override
        public int size() {
            return graph.size();
        }

        @Override
        public boolean contains(String id) {
            return graph.contains(id);
        }

        @Override
        public Optional<StepNode> node(String id) {
            return graph.node(id);
        }

        @Override
        public Optional<StepNode> lastNode() {
            return graph.lastNode();
        }
    }
}
