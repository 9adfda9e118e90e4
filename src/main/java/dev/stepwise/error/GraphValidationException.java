package dev.stepwise.error;

public final class GraphValidationException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public GraphValidationException(String reason) {
        super("Invalid step graph: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
