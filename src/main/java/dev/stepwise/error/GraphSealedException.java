package dev.stepwise.error;

public final class GraphSealedException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    public GraphSealedException(String nodeId) {
        super("Cannot append node '%s': step graph is sealed".formatted(nodeId));
    }
}
