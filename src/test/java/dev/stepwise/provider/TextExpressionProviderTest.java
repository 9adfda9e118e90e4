package dev.stepwise.provider;

import dev.stepwise.error.ExpressionParseException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextExpressionProviderTest {

    private final TextExpressionProvider provider = new TextExpressionProvider();

    private void assertRejected(String text, String code) {
        assertThatThrownBy(() -> provider.parse(text))
            .isInstanceOfSatisfying(ExpressionParseException.class, e -> assertThat(e.code()).isEqualTo(code));
    }

    @Test
    void parseStripsWhitespace() {
        Expression expression = provider.parse("  sin(x) * 2 + 1 ");

        assertThat(provider.render(expression)).isEqualTo("sin(x)*2+1");
    }

    @Test
    void rendersParsedTextUnchangedTwice() {
        String once = provider.render(provider.parse("x^2 + 3*x"));
        String twice = provider.render(provider.parse(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void rejectsEmpty() {
        assertRejected("   ", "EMPTY_EXPRESSION");
        assertRejected(null, "EMPTY_EXPRESSION");
    }

    @Test
    void rejectsTooLong() {
        assertRejected("x+".repeat(300) + "x", "TOO_LONG");
    }

    @Test
    void rejectsForbiddenPatterns() {
        assertRejected("__class__", "FORBIDDEN_PATTERN");
        assertRejected("eval(x)", "FORBIDDEN_PATTERN");
        assertRejected("x;y", "FORBIDDEN_PATTERN");
    }

    @Test
    void rejectsInvalidCharacters() {
        assertThatThrownBy(() -> provider.parse("x & y"))
            .isInstanceOfSatisfying(ExpressionParseException.class, e -> {
                assertThat(e.code()).isEqualTo("INVALID_CHARACTERS");
                assertThat(e.getMessage()).contains("&");
            });
    }

    @Test
    void rejectsUnbalancedParentheses() {
        assertRejected("(x+1", "UNBALANCED_PARENS");
        assertRejected("x+1)", "UNBALANCED_PARENS");
        assertRejected(")x(", "UNBALANCED_PARENS");
    }

    @Test
    void rejectsLiteralDivisionByZero() {
        assertRejected("x/0", "DIVISION_BY_ZERO");
        assertRejected("(x/ 0)", "DIVISION_BY_ZERO");
    }

    @Test
    void allowsDivisionByNumbersStartingWithZero() {
        assertThat(provider.render(provider.parse("x/0.5"))).isEqualTo("x/0.5");
    }

    @Test
    void replaceRewritesFirstOccurrence() {
        Expression result = provider.applyNamedOperation(provider.parse("x+0+0"), "replace",
            Map.of("target", "+0", "replacement", ""));

        assertThat(provider.render(result)).isEqualTo("x+0");
    }

    @Test
    void replaceAllRewritesEveryOccurrence() {
        Expression result = provider.applyNamedOperation(provider.parse("x+0+0"), "replace-all",
            Map.of("target", "+0"));

        assertThat(provider.render(result)).isEqualTo("x");
    }

    @Test
    void regexReplaceRewritesFirstMatch() {
        Expression result = provider.applyNamedOperation(provider.parse("x^1*y^1"), "regex-replace",
            Map.of("pattern", "\\^1", "replacement", ""));

        assertThat(provider.render(result)).isEqualTo("x*y^1");
    }

    @Test
    void unknownOperationIsRejected() {
        assertThatThrownBy(() -> provider.applyNamedOperation(provider.parse("x"), "integrate", Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("integrate");
    }

    @Test
    void missingParameterIsRejected() {
        assertThatThrownBy(() -> provider.applyNamedOperation(provider.parse("x"), "replace", Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("target");
    }

    @Test
    void foreignExpressionIsRejected() {
        Expression foreign = new Expression() {};

        assertThatThrownBy(() -> provider.render(foreign)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wrapSkipsInputChecks() {
        Expression wrapped = provider.wrap("x/0");

        assertThat(provider.render(wrapped)).isEqualTo("x/0");
        assertRejected("x/0", "DIVISION_BY_ZERO");
    }
}
