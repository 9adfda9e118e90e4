package dev.stepwise.provider;

import java.util.Map;

/**
 * The symbolic-computation capability rules delegate to: parsing, named transformations and
 * rendering back to text.
 *
 * <p>Implementations must be thread-safe and deterministic: {@link #render} of the same
 * expression always yields the same text.
 */
public interface ExpressionProvider {

    /** Short identifier, e.g. {@code text}. */
    String id();

    /**
     * Parse source text.
     *
     * @throws dev.stepwise.error.ExpressionParseException if the text is not a valid expression
     */
    Expression parse(String text);

    /**
     * Rebuild an expression from text this provider rendered earlier. Unlike {@link #parse}
     * no input checks run, so intermediate results of a run are never rejected.
     */
    Expression wrap(String rendered);

    /**
     * Apply a named operation such as {@code replace}.
     *
     * @throws IllegalArgumentException if the operation is unknown or its parameters are missing
     */
    Expression applyNamedOperation(Expression expression, String operation, Map<String, String> params);

    String render(Expression expression);
}
