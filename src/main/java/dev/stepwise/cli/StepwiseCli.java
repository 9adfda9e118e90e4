package dev.stepwise.cli;

import dev.stepwise.engine.RuleSetLoader;
import dev.stepwise.engine.RuleSetValidator;
import dev.stepwise.engine.RunOptions;
import dev.stepwise.engine.StepEngine;
import dev.stepwise.error.RuleSetLoadException;
import dev.stepwise.error.StepEngineException;
import dev.stepwise.error.StepInputException;
import dev.stepwise.error.StepInvariantException;
import dev.stepwise.model.EngineConfig;
import dev.stepwise.model.RuleSet;
import dev.stepwise.model.StepResult;
import dev.stepwise.model.Verbosity;
import dev.stepwise.provider.ExpressionProvider;
import dev.stepwise.provider.TextExpressionProvider;
import dev.stepwise.render.StepRenderer;
import dev.stepwise.rule.DeclarativeRule;
import dev.stepwise.rule.Rule;
import dev.stepwise.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point: load rule sets, run one expression, print the steps.
 */
@Command(
    name = "stepwise",
    mixinStandardHelpOptions = true,
    description = "Show the step-by-step rule applications that transform an expression."
)
public class StepwiseCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(StepwiseCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USER_ERROR = 1;
    static final int EXIT_INTERNAL_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Expression to transform")
    private String expression;

    @Option(names = "--rules", description = "Rule set JSON file or directory of files (default: bundled rules)")
    private Path rules;

    @Option(names = "--operation", defaultValue = "simplify", description = "Operation to run (default: ${DEFAULT-VALUE})")
    private String operation;

    @Option(names = "--variable", defaultValue = StepEngine.DEFAULT_VARIABLE,
        description = "Variable of the operation (default: ${DEFAULT-VALUE})")
    private String variable;

    @Option(names = "--verbosity", defaultValue = "detailed", description = "concise, detailed or teacher")
    private String verbosity;

    @Option(names = "--format", defaultValue = "text", description = "Output format: text or json")
    private String format;

    @Option(names = "--max-iterations", description = "Override the rule set's iteration cap")
    private Integer maxIterations;

    @Option(names = "--domain", description = "Only use rules tagged with this domain (repeatable)")
    private List<String> domains;

    @Option(names = "--timeout", description = "Seconds before the run is abandoned; 0 disables (default: 3)")
    private Double timeout;

    @Option(names = "--list", description = "List loaded rules by operation")
    private boolean list;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            List<RuleSet> ruleSets = loadRuleSets();
            ExpressionProvider provider = new TextExpressionProvider();
            RuleRegistry registry = new RuleRegistry();
            for (RuleSet ruleSet : ruleSets) {
                registry.registerAll(DeclarativeRule.fromDefinitions(ruleSet.rules(), provider));
            }

            if (list) {
                printRules(registry, out);
                return EXIT_OK;
            }
            if (expression == null) {
                err.println("Error: expression required. Use --list to see available rules.");
                return EXIT_USER_ERROR;
            }

            Verbosity level = Verbosity.parse(verbosity);
            StepRenderer renderer = StepRenderer.forFormat(format);
            double budget = TimeoutRunner.validateTimeout(timeout);
            StepEngine engine = new StepEngine(registry, provider, engineConfig(ruleSets));
            RunOptions options = domains == null ? RunOptions.defaults() : RunOptions.forDomains(Set.copyOf(domains));

            StepResult result = TimeoutRunner.run(
                () -> engine.run(operation, expression, variable, options), budget);
            out.println(renderer.render(result, level));
            return EXIT_OK;
        } catch (StepInputException | IllegalArgumentException e) {
            err.println("Error: " + message(e));
            return EXIT_USER_ERROR;
        } catch (IOException e) {
            err.println("Error: could not read rules: " + e.getMessage());
            return EXIT_USER_ERROR;
        } catch (StepInvariantException e) {
            LOG.error("Internal error while running {}", operation, e);
            err.println("Internal error: " + e.detail());
            return EXIT_INTERNAL_ERROR;
        }
    }

    private static String message(RuntimeException e) {
        return e instanceof StepEngineException engineError ? engineError.detail() : e.getMessage();
    }

    private List<RuleSet> loadRuleSets() throws IOException {
        List<RuleSet> ruleSets;
        String source;
        if (rules == null) {
            ruleSets = List.of(RuleSetLoader.loadBundled());
            source = RuleSetLoader.BUNDLED_RESOURCE;
        } else if (Files.isDirectory(rules)) {
            ruleSets = RuleSetLoader.loadFromDirectory(rules);
            source = rules.toString();
        } else {
            ruleSets = List.of(RuleSetLoader.loadFromFile(rules));
            source = rules.toString();
        }
        for (RuleSet ruleSet : ruleSets) {
            List<String> problems = RuleSetValidator.validate(ruleSet);
            if (!problems.isEmpty()) {
                throw new RuleSetLoadException(source, problems);
            }
        }
        return ruleSets;
    }

    /**
     * The largest cap among the loaded rule sets, unless overridden on the command line.
     */
    private EngineConfig engineConfig(List<RuleSet> ruleSets) {
        if (maxIterations != null) {
            return new EngineConfig(maxIterations);
        }
        return ruleSets.stream()
            .map(RuleSet::engine)
            .max(Comparator.comparingInt(EngineConfig::maxIterations))
            .orElseGet(EngineConfig::defaults);
    }

    private static void printRules(RuleRegistry registry, PrintWriter out) {
        out.println("Available rules:");
        for (String op : registry.operations()) {
            out.println("  " + op);
            for (Rule rule : registry.rulesFor(op)) {
                out.printf("    %-20s priority %-4d %s%n", rule.name(), rule.priority(), rule.domains());
            }
        }
    }
}
