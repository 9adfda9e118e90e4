package dev.stepwise.error;

public final class DuplicateIdException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public DuplicateIdException(String nodeId) {
        super("Duplicate step node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
