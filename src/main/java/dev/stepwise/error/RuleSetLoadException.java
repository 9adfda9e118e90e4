package dev.stepwise.error;

import java.util.List;

/**
 * A rule-set file could not be read, or it was read but describes invalid rules.
 */
public final class RuleSetLoadException extends StepInputException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final List<String> problems;

    public RuleSetLoadException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.problems = List.of();
    }

    public RuleSetLoadException(String source, List<String> problems) {
        super("Invalid rule set %s: %s".formatted(source, String.join("; ", problems)));
        this.source = source;
        this.problems = List.copyOf(problems);
    }

    /** Path or resource name the rule set came from. */
    public String source() {
        return source;
    }

    /** Validation problems, empty when the failure was an I/O or syntax error. */
    public List<String> problems() {
        return problems;
    }
}
