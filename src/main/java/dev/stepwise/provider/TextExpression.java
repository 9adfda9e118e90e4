package dev.stepwise.provider;

/**
 * Expression held as canonical text (no whitespace).
 */
public record TextExpression(String text) implements Expression {

    @Override
    public String toString() {
        return text;
    }
}
