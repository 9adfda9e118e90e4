package dev.stepwise.error;

/**
 * Root of every exception raised by the step engine. Never thrown directly: concrete types sit
 * under {@link StepInputException} (the caller supplied something unusable) or
 * {@link StepInvariantException} (a rule author or the engine broke an invariant).
 */
public abstract class StepEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Who the failure is meant for. */
    public enum Channel {
        /** Reportable to the end user. */
        INPUT,
        /** A programming error; log and fail. */
        INVARIANT
    }

    private final Channel channel;

    protected StepEngineException(String message, Channel channel) {
        super(message);
        this.channel = channel;
    }

    protected StepEngineException(String message, Throwable cause, Channel channel) {
        super(message, cause);
        this.channel = channel;
    }

    public Channel channel() {
        return channel;
    }

    /** Alias for {@link #getMessage()}. */
    public String detail() {
        return getMessage();
    }
}
