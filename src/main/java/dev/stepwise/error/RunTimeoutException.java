package dev.stepwise.error;

/**
 * A run did not finish within the caller's time budget. No partial result is kept.
 */
public final class RunTimeoutException extends StepInputException {

    private static final long serialVersionUID = 1L;

    private final double timeoutSeconds;

    public RunTimeoutException(double timeoutSeconds) {
        super("Operation exceeded %.1fs timeout".formatted(timeoutSeconds));
        this.timeoutSeconds = timeoutSeconds;
    }

    public double timeoutSeconds() {
        return timeoutSeconds;
    }
}
