package dev.stepwise.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.stepwise.model.StepNode;
import dev.stepwise.model.StepResult;
import dev.stepwise.model.Verbosity;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pretty-printed JSON with keys sorted, so identical runs give identical bytes. Each step
 * carries the explanation variant for the requested verbosity.
 */
public final class JsonStepRenderer implements StepRenderer {

    public static final String FORMAT = "json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    @Override
    public String format() {
        return FORMAT;
    }

    @Override
    public String render(StepResult result, Verbosity verbosity) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("operation", result.operation());
        payload.put("input", result.input());
        payload.put("output", result.output());
        payload.put("verbosity", verbosity.label());

        List<Map<String, Object>> steps = new ArrayList<>();
        for (StepNode node : result.graph().nodes()) {
            var step = new LinkedHashMap<String, Object>();
            step.put("id", node.id());
            step.put("operation", node.operation());
            step.put("rule", node.rule());
            step.put("input", node.input());
            step.put("output", node.output());
            step.put("explanation", node.explanation().forVerbosity(verbosity));
            step.put("dependencies", node.dependencies());
            step.put("metadata", node.metadata());
            steps.add(step);
        }
        payload.put("steps", steps);

        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render step graph as JSON", e);
        }
    }
}
