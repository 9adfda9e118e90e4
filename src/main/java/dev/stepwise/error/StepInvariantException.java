package dev.stepwise.error;

/**
 * Abstract parent for broken invariants: bad dependency ids, duplicate ids or rule names,
 * writes to a sealed graph, failing rules, malformed graphs. Always fatal.
 */
public abstract class StepInvariantException extends StepEngineException {

    private static final long serialVersionUID = 1L;

    protected StepInvariantException(String message) {
        super(message, Channel.INVARIANT);
    }

    protected StepInvariantException(String message, Throwable cause) {
        super(message, cause, Channel.INVARIANT);
    }
}
