package dev.stepwise.error;

/**
 * A node names a dependency that is not (yet) in the graph.
 */
public final class DependencyException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;
    private final String missingId;

    public DependencyException(String nodeId, String missingId) {
        super("Node '%s' depends on unknown node '%s'".formatted(nodeId, missingId));
        this.nodeId = nodeId;
        this.missingId = missingId;
    }

    public String nodeId() {
        return nodeId;
    }

    public String missingId() {
        return missingId;
    }
}
