package dev.stepwise.error;

/**
 * A rule's {@code apply} threw. Its exception is kept as the cause.
 */
public final class RuleApplicationException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;

    public RuleApplicationException(String ruleName, Throwable cause) {
        super("Rule '%s' failed: %s".formatted(ruleName, cause.getMessage()), cause);
        this.ruleName = ruleName;
    }

    public RuleApplicationException(String ruleName, String message) {
        super("Rule '%s' failed: %s".formatted(ruleName, message));
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }
}
