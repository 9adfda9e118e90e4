package dev.stepwise.provider;

/**
 * Parsed expression owned by an {@link ExpressionProvider}. The engine never looks inside; it
 * only hands expressions back to the provider that created them.
 */
public interface Expression {
}
