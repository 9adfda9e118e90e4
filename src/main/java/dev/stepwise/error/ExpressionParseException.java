package dev.stepwise.error;

/**
 * The input text is not a usable expression (or the variable name is not usable). Raised
 * before any rule runs.
 */
public final class ExpressionParseException extends StepInputException {

    private static final long serialVersionUID = 1L;

    private final String code;

    public ExpressionParseException(String message, String code) {
        super(message);
        this.code = code;
    }

    public ExpressionParseException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Machine-readable reason, e.g. {@code UNBALANCED_PARENS}. */
    public String code() {
        return code;
    }
}
