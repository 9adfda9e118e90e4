package dev.stepwise.error;

/**
 * Abstract parent for failures caused by what the caller passed in: malformed expressions,
 * rule sets that diverge, unreadable rule files.
 */
public abstract class StepInputException extends StepEngineException {

    private static final long serialVersionUID = 1L;

    protected StepInputException(String message) {
        super(message, Channel.INPUT);
    }

    protected StepInputException(String message, Throwable cause) {
        super(message, cause, Channel.INPUT);
    }
}
