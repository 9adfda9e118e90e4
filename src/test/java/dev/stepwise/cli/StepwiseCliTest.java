package dev.stepwise.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StepwiseCliTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        var cmd = new CommandLine(new StepwiseCli());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void simplifiesWithBundledRules() {
        int exit = execute("x*1 + 0");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        assertThat(out.toString())
            .contains("Operation: simplify")
            .contains("Output: x")
            .contains("- [add-zero] x*1+0 -> x*1")
            .contains("- [multiply-one] x*1 -> x");
    }

    @Test
    void listsBundledRules() {
        int exit = execute("--list");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        assertThat(out.toString()).startsWith("Available rules:").contains("simplify").contains("add-zero");
    }

    @Test
    void missingExpressionIsUserError() {
        int exit = execute();

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("expression required");
    }

    @Test
    void parseErrorIsUserError() {
        int exit = execute("x+(1");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("Error: Unbalanced parentheses");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownVerbosityIsUserError() {
        assertThat(execute("--verbosity", "chatty", "x")).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("chatty");
    }

    @Test
    void jsonFormatPrintsSteps() throws IOException {
        int exit = execute("--format", "json", "--verbosity", "concise", "2*x^0");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("output").asText()).isEqualTo("2");
        assertThat(root.get("verbosity").asText()).isEqualTo("concise");
        assertThat(root.get("steps")).hasSize(2);
        assertThat(root.get("steps").get(0).get("rule").asText()).isEqualTo("power-zero");
    }

    @Test
    void iterationCapOverrideCanStopARun() {
        int exit = execute("--max-iterations", "1", "0+1*x^1+0");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("did not converge");
    }

    @Test
    void domainOptionRestrictsRules() {
        int exit = execute("--domain", "exponents", "--verbosity", "concise", "x^1+0");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        assertThat(out.toString()).contains("Output: x+0");
    }

    @Test
    void customRulesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("swap.json");
        Files.writeString(file, """
            {
              "id": "swap",
              "rules": [
                {
                  "name": "cos-to-sin",
                  "operation": "rename",
                  "match": { "contains": "cos" },
                  "transform": { "op": "replace-all", "target": "cos", "replacement": "sin" },
                  "explanation": "Rename cos to sin"
                }
              ]
            }
            """);

        int exit = execute("--rules", file.toString(), "--operation", "rename", "cos(x)+cos(y)");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        assertThat(out.toString()).contains("Output: sin(x)+sin(y)").contains("[cos-to-sin]");
    }

    @Test
    void invalidRulesFileIsUserError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, """
            { "id": "broken", "rules": [] }
            """);

        int exit = execute("--rules", file.toString(), "x");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("defines no rules");
    }

    @Test
    void malformedJsonIsUserError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("garbage.json");
        Files.writeString(file, "{ not json");

        assertThat(execute("--rules", file.toString(), "x")).isEqualTo(StepwiseCli.EXIT_USER_ERROR);
        assertThat(err.toString()).contains("could not read rules");
    }

    @Test
    void rewriteIntoRejectedInputShapeIsNotAnInternalError() {
        int exit = execute("x^1/0+0");

        assertThat(exit).isEqualTo(StepwiseCli.EXIT_OK);
        assertThat(out.toString()).contains("Output: x/0");
        assertThat(err.toString()).doesNotContain("Internal error");
    }
}
