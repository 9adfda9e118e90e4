package dev.stepwise.rule;

import dev.stepwise.model.Explanation;
import dev.stepwise.model.RuleDefinition;
import dev.stepwise.model.RuleMatch;
import dev.stepwise.provider.Expression;
import dev.stepwise.provider.ExpressionProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Rule backed by a {@link RuleDefinition}: matching is done on the rendered text, the
 * transformation is delegated to the provider's named operation.
 */
public final class DeclarativeRule implements Rule {

    private static final String VARIABLE_PLACEHOLDER = "{variable}";

    private final RuleDefinition definition;
    private final ExpressionProvider provider;
    private final Pattern pattern; // null unless match is Regex

    public DeclarativeRule(RuleDefinition definition, ExpressionProvider provider) {
        this.definition = definition;
        this.provider = provider;
        this.pattern = definition.match() instanceof RuleMatch.Regex regex
            ? Pattern.compile(regex.pattern())
            : null;
    }

    public static List<Rule> fromDefinitions(List<RuleDefinition> definitions, ExpressionProvider provider) {
        return definitions.stream()
            .<Rule>map(d -> new DeclarativeRule(d, provider))
            .toList();
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public String operation() {
        return definition.operation();
    }

    @Override
    public int priority() {
        return definition.priority();
    }

    @Override
    public Set<String> domains() {
        return definition.domains();
    }

    @Override
    public boolean isApplicable(String expression) {
        RuleMatch match = definition.match();
        if (match instanceof RuleMatch.Equals eq) {
            return expression.equals(eq.value());
        }
        if (match instanceof RuleMatch.Contains contains) {
            return expression.contains(contains.value());
        }
        return pattern.matcher(expression).find();
    }

    @Override
    public RuleOutcome apply(String expression, RuleContext context) {
        Expression current = provider.wrap(expression);
        Expression transformed = provider.applyNamedOperation(current, definition.transform(), definition.params());
        String output = provider.render(transformed);

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("domains", List.copyOf(new TreeSet<>(definition.domains())));
        metadata.put("transform", definition.transform());

        return new RuleOutcome(output, explain(context.variable()), List.of(), metadata);
    }

    private Explanation explain(String variable) {
        Explanation template = definition.explanation();
        return new Explanation(
            substitute(template.concise(), variable),
            substitute(template.detailed(), variable),
            substitute(template.teacher(), variable));
    }

    private static String substitute(String text, String variable) {
        return text == null ? null : text.replace(VARIABLE_PLACEHOLDER, variable);
    }

    @Override
    public String toString() {
        return "DeclarativeRule[%s/%s, priority=%d]".formatted(operation(), name(), priority());
    }
}
