package dev.stepwise.engine;

import dev.stepwise.error.ExpressionParseException;
import dev.stepwise.error.NonConvergenceException;
import dev.stepwise.error.RuleApplicationException;
import dev.stepwise.model.EngineConfig;
import dev.stepwise.model.StepGraph;
import dev.stepwise.model.StepNode;
import dev.stepwise.model.StepResult;
import dev.stepwise.provider.ExpressionProvider;
import dev.stepwise.rule.Rule;
import dev.stepwise.rule.RuleContext;
import dev.stepwise.rule.RuleOutcome;
import dev.stepwise.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Greedy rewrite loop: at each step the first applicable rule (highest priority, then
 * registration order) fires and is recorded as a {@link StepNode}. The run ends successfully
 * when no rule applies, and fails with {@link NonConvergenceException} when
 * {@link EngineConfig#maxIterations()} rules have fired and another one still applies.
 *
 * <p>A run is synchronous and single-threaded. Separate runs share only the locked
 * {@link RuleRegistry}, so one engine may serve concurrent callers.
 */
public final class StepEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StepEngine.class);

    public static final String DEFAULT_VARIABLE = "x";
    public static final int MAX_VARIABLE_LENGTH = 20;

    private static final Pattern VARIABLE = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private final RuleRegistry registry;
    private final ExpressionProvider provider;
    private final EngineConfig config;

    /**
     * Create an engine. The registry is locked here; register every rule before this call.
     */
    public StepEngine(RuleRegistry registry, ExpressionProvider provider, EngineConfig config) {
        this.registry = registry;
        this.provider = provider;
        this.config = config;
        registry.lock();
    }

    public StepEngine(RuleRegistry registry, ExpressionProvider provider) {
        this(registry, provider, EngineConfig.defaults());
    }

    public RuleRegistry registry() {
        return registry;
    }

    public EngineConfig config() {
        return config;
    }

    public StepResult run(String operation, String expression) {
        return run(operation, expression, DEFAULT_VARIABLE, RunOptions.defaults());
    }

    /**
     * Run the rule loop for one request.
     *
     * @return the sealed graph and final expression; an empty graph when no rule applied to the
     *     input
     * @throws ExpressionParseException  if the expression or variable is invalid
     * @throws NonConvergenceException   if the iteration cap is hit; carries the partial graph
     * @throws RuleApplicationException  if a rule throws
     */
    public StepResult run(String operation, String expression, String variable, RunOptions options) {
        String var = validateVariable(variable);
        String current = provider.render(provider.parse(expression));
        List<Rule> rules = candidates(operation, options);

        LOG.debug("Running {} on '{}' (variable {}, {} candidate rules)", operation, current, var, rules.size());

        StepGraph graph = StepGraph.empty();
        int applied = 0;

        while (true) {
            Rule rule = select(rules, current);
            if (rule == null) {
                break;
            }
            if (applied >= config.maxIterations()) {
                graph.seal();
                LOG.warn("Operation {} did not converge after {} steps; last rule still applicable: {}",
                    operation, applied, rule.name());
                throw new NonConvergenceException(operation, config.maxIterations(), graph);
            }

            RuleOutcome outcome = applyRule(rule, current, new RuleContext(operation, var, graph.view()));
            StepNode node = new StepNode(
                nodeId(applied + 1),
                operation,
                rule.name(),
                current,
                outcome.output(),
                outcome.explanation(),
                dependenciesFor(outcome, graph),
                outcome.metadata());
            graph.append(node);
            applied++;

            LOG.debug("{} [{}] {} -> {}", node.id(), rule.name(), current, outcome.output());
            current = outcome.output();
        }

        graph.seal();
        LOG.debug("Finished {} in {} steps: {}", operation, graph.size(), current);
        return new StepResult(operation, expression, current, graph);
    }

    /** Names of the rules registered for an operation, in selection order. */
    public List<String> availableRules(String operation) {
        return registry.ruleNames(operation);
    }

    /**
     * Check that a variable name is a plain identifier of reasonable length.
     *
     * @throws ExpressionParseException with code {@code INVALID_VARIABLE}
     */
    public static String validateVariable(String variable) {
        if (variable == null || variable.isBlank()) {
            throw new ExpressionParseException("Variable name cannot be empty", "INVALID_VARIABLE");
        }
        String trimmed = variable.strip();
        if (trimmed.length() > MAX_VARIABLE_LENGTH) {
            throw new ExpressionParseException(
                "Variable name too long (max %d characters)".formatted(MAX_VARIABLE_LENGTH), "INVALID_VARIABLE");
        }
        if (!VARIABLE.matcher(trimmed).matches()) {
            throw new ExpressionParseException("Variable name must be an identifier: " + trimmed, "INVALID_VARIABLE");
        }
        return trimmed;
    }

    static String nodeId(int sequence) {
        return "step_%03d".formatted(sequence);
    }

    private List<Rule> candidates(String operation, RunOptions options) {
        List<Rule> rules = registry.rulesFor(operation);
        if (options.domains().isEmpty()) {
            return rules;
        }
        return rules.stream().filter(r -> options.admits(r.domains())).toList();
    }

    private static Rule select(List<Rule> rules, String expression) {
        for (Rule rule : rules) {
            boolean applicable;
            try {
                applicable = rule.isApplicable(expression);
            } catch (RuntimeException e) {
                LOG.warn("Applicability check of rule {} failed on '{}'", rule.name(), expression, e);
                throw new RuleApplicationException(rule.name(), e);
            }
            if (applicable) {
                return rule;
            }
        }
        return null;
    }

    private static RuleOutcome applyRule(Rule rule, String expression, RuleContext context) {
        RuleOutcome outcome;
        try {
            outcome = rule.apply(expression, context);
        } catch (RuntimeException e) {
            LOG.warn("Rule {} failed on '{}'", rule.name(), expression, e);
            throw new RuleApplicationException(rule.name(), e);
        }
        if (outcome == null) {
            throw new RuleApplicationException(rule.name(), "apply returned no outcome");
        }
        return outcome;
    }

    private static List<String> dependenciesFor(RuleOutcome outcome, StepGraph graph) {
        if (!outcome.dependencies().isEmpty()) {
            return outcome.dependencies();
        }
        return graph.lastNode().map(last -> List.of(last.id())).orElse(List.of());
    }
}
