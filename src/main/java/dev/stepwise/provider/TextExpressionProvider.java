package dev.stepwise.provider;

import dev.stepwise.error.ExpressionParseException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Provider that keeps expressions as text and rewrites them with literal and regex
 * substitutions. Parsing is a safety gate: it rejects anything outside a small arithmetic
 * alphabet before any rule sees it.
 */
public final class TextExpressionProvider implements ExpressionProvider {

    public static final String ID = "text";

    public static final int MAX_EXPRESSION_LENGTH = 500;

    public static final String OP_REPLACE = "replace";
    public static final String OP_REPLACE_ALL = "replace-all";
    public static final String OP_REGEX_REPLACE = "regex-replace";

    public static final Set<String> OPERATIONS = Set.of(OP_REPLACE, OP_REPLACE_ALL, OP_REGEX_REPLACE);

    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9\\s+\\-*/^().,_]+$");
    private static final Pattern DIVISION_BY_ZERO = Pattern.compile("/\\s*0(?:\\s|$|\\))");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Pattern> FORBIDDEN = List.of(
        Pattern.compile("__"),
        Pattern.compile("import", Pattern.CASE_INSENSITIVE),
        Pattern.compile("eval", Pattern.CASE_INSENSITIVE),
        Pattern.compile("exec", Pattern.CASE_INSENSITIVE),
        Pattern.compile("compile", Pattern.CASE_INSENSITIVE),
        Pattern.compile("open", Pattern.CASE_INSENSITIVE),
        Pattern.compile("system", Pattern.CASE_INSENSITIVE),
        Pattern.compile("lambda", Pattern.CASE_INSENSITIVE),
        Pattern.compile(";"),
        Pattern.compile("\\.\\./")
    );

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Expression cannot be empty", "EMPTY_EXPRESSION");
        }
        String trimmed = text.strip();
        if (trimmed.length() > MAX_EXPRESSION_LENGTH) {
            throw new ExpressionParseException(
                "Expression too long (max %d characters)".formatted(MAX_EXPRESSION_LENGTH), "TOO_LONG");
        }
        for (Pattern forbidden : FORBIDDEN) {
            if (forbidden.matcher(trimmed).find()) {
                throw new ExpressionParseException(
                    "Expression contains forbidden pattern: " + forbidden.pattern(), "FORBIDDEN_PATTERN");
            }
        }
        if (!ALLOWED.matcher(trimmed).matches()) {
            throw new ExpressionParseException(
                "Expression contains invalid characters: " + String.join(", ", disallowed(trimmed)),
                "INVALID_CHARACTERS");
        }
        checkParentheses(trimmed);
        if (DIVISION_BY_ZERO.matcher(trimmed).find()) {
            throw new ExpressionParseException("Division by zero detected", "DIVISION_BY_ZERO");
        }
        return new TextExpression(WHITESPACE.matcher(trimmed).replaceAll(""));
    }

    @Override
    public Expression wrap(String rendered) {
        return new TextExpression(rendered);
    }

    @Override
    public Expression applyNamedOperation(Expression expression, String operation, Map<String, String> params) {
        String text = textOf(expression);
        String result = switch (operation) {
            case OP_REPLACE -> {
                String target = required(params, "target", operation);
                int at = text.indexOf(target);
                yield at < 0 ? text
                    : text.substring(0, at) + params.getOrDefault("replacement", "") + text.substring(at + target.length());
            }
            case OP_REPLACE_ALL -> text.replace(
                required(params, "target", operation), params.getOrDefault("replacement", ""));
            case OP_REGEX_REPLACE -> regexReplaceFirst(text,
                required(params, "pattern", operation), params.getOrDefault("replacement", ""));
            default -> throw new IllegalArgumentException("Unknown provider operation: " + operation);
        };
        return new TextExpression(result);
    }

    @Override
    public String render(Expression expression) {
        return textOf(expression);
    }

    private static String regexReplaceFirst(String text, String pattern, String replacement) {
        Matcher matcher;
        try {
            matcher = Pattern.compile(pattern).matcher(text);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern '%s': %s".formatted(pattern, e.getDescription()), e);
        }
        return matcher.replaceFirst(replacement);
    }

    private static String required(Map<String, String> params, String key, String operation) {
        String value = params.get(key);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Operation '%s' requires parameter '%s'".formatted(operation, key));
        }
        return value;
    }

    private static String textOf(Expression expression) {
        if (expression instanceof TextExpression text) {
            return text.text();
        }
        throw new IllegalArgumentException("Not a text expression: " + expression);
    }

    private static void checkParentheses(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            if (depth < 0) {
                throw new ExpressionParseException("Unbalanced parentheses (too many closing)", "UNBALANCED_PARENS");
            }
        }
        if (depth != 0) {
            throw new ExpressionParseException("Unbalanced parentheses (unclosed opening)", "UNBALANCED_PARENS");
        }
    }

    private static Set<String> disallowed(String text) {
        var chars = new TreeSet<String>();
        text.codePoints()
            .filter(cp -> !ALLOWED.matcher(Character.toString(cp)).matches())
            .forEach(cp -> chars.add(Character.toString(cp)));
        return chars;
    }
}
