package dev.stepwise.error;

public final class DuplicateRuleNameException extends StepInvariantException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final String ruleName;

    public DuplicateRuleNameException(String operation, String ruleName) {
        super("Rule '%s' is already registered for operation '%s'".formatted(ruleName, operation));
        this.operation = operation;
        this.ruleName = ruleName;
    }

    public String operation() {
        return operation;
    }

    public String ruleName() {
        return ruleName;
    }
}
