package dev.stepwise.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.stepwise.error.RuleSetLoadException;
import dev.stepwise.model.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads rule sets from JSON. A rule set looks like:
 *
 * <pre>
 * {
 *   "id": "simplify-basics",
 *   "description": "...",
 *   "engine": { "maxIterations": 64 },
 *   "rules": [
 *     {
 *       "name": "add-zero",
 *       "operation": "simplify",
 *       "priority": 50,
 *       "domains": ["algebra"],
 *       "match": { "regex": "\\+0(?![0-9.])" },
 *       "transform": { "op": "regex-replace", "pattern": "...", "replacement": "" },
 *       "explanation": { "concise": "...", "detailed": "...", "teacher": "..." }
 *     }
 *   ]
 * }
 * </pre>
 */
public final class RuleSetLoader {

    /** Classpath location of the rule set shipped with the jar. */
    public static final String BUNDLED_RESOURCE = "rules/simplify.json";

    public static final int DEFAULT_PRIORITY = 0;
    public static final Set<String> DEFAULT_DOMAINS = Set.of("general");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RuleSetLoader() {}

    /**
     * Load a single rule set from a JSON file.
     */
    public static RuleSet loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseRuleSet(root, path.toString());
    }

    /**
     * Load a single rule set from a JSON string.
     */
    public static RuleSet loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseRuleSet(root, "<string>");
    }

    /**
     * Load a rule set from the classpath.
     */
    public static RuleSet loadResource(String resource) throws IOException {
        try (InputStream in = RuleSetLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RuleSetLoadException("Rule set resource not found: " + resource, resource, null);
            }
            return parseRuleSet(MAPPER.readTree(in), resource);
        }
    }

    public static RuleSet loadBundled() throws IOException {
        return loadResource(BUNDLED_RESOURCE);
    }

    /**
     * Load all rule sets from a directory of JSON files, in file-name order. The order matters:
     * it becomes registration order, which breaks priority ties.
     */
    public static List<RuleSet> loadFromDirectory(Path dir) throws IOException {
        var ruleSets = new ArrayList<RuleSet>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(p -> {
                     try {
                         ruleSets.add(loadFromFile(p));
                     } catch (IOException e) {
                         throw new RuleSetLoadException("Failed to load rule set from " + p, p.toString(), e);
                     }
                 });
        }
        return ruleSets;
    }

    private static RuleSet parseRuleSet(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new RuleSetLoadException("Rule set must be a JSON object", source, null);
        }
        String id = text(root, "id", source);
        String description = root.has("description") ? root.get("description").asText() : "";
        EngineConfig engine = parseEngineConfig(root.get("engine"), source);

        JsonNode rulesNode = root.get("rules");
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new RuleSetLoadException("Rule set '%s' has no 'rules' array".formatted(id), source, null);
        }
        var rules = new ArrayList<RuleDefinition>();
        for (JsonNode ruleNode : rulesNode) {
            rules.add(parseRule(ruleNode, source));
        }
        return new RuleSet(id, description, engine, List.copyOf(rules));
    }

    private static EngineConfig parseEngineConfig(JsonNode node, String source) {
        if (node == null) {
            return EngineConfig.defaults();
        }
        int maxIterations = node.has("maxIterations")
            ? node.get("maxIterations").asInt() : EngineConfig.DEFAULT_MAX_ITERATIONS;
        try {
            return new EngineConfig(maxIterations);
        } catch (IllegalArgumentException e) {
            throw new RuleSetLoadException("Invalid engine block: " + e.getMessage(), source, e);
        }
    }

    private static RuleDefinition parseRule(JsonNode node, String source) {
        String name = text(node, "name", source);
        String operation = text(node, "operation", source);
        int priority = node.has("priority") ? node.get("priority").asInt() : DEFAULT_PRIORITY;

        Set<String> domains = new LinkedHashSet<>();
        if (node.has("domains")) {
            node.get("domains").forEach(d -> domains.add(d.asText()));
        } else {
            domains.addAll(DEFAULT_DOMAINS);
        }

        RuleMatch match = parseMatch(node.get("match"), name, source);

        JsonNode transformNode = node.get("transform");
        if (transformNode == null || !transformNode.isObject()) {
            throw new RuleSetLoadException("Rule '%s' has no 'transform' object".formatted(name), source, null);
        }
        String transform = text(transformNode, "op", source);
        Map<String, String> params = new LinkedHashMap<>();
        for (var entry : transformNode.properties()) {
            if (!"op".equals(entry.getKey())) {
                params.put(entry.getKey(), entry.getValue().asText());
            }
        }

        Explanation explanation = parseExplanation(node.get("explanation"), name, source);

        return new RuleDefinition(name, operation, priority, Collections.unmodifiableSet(domains), match,
            transform, Collections.unmodifiableMap(params), explanation);
    }

    private static RuleMatch parseMatch(JsonNode node, String rule, String source) {
        if (node == null) {
            throw new RuleSetLoadException("Rule '%s' has no 'match'".formatted(rule), source, null);
        }
        if (node.has("equals")) {
            return new RuleMatch.Equals(node.get("equals").asText());
        } else if (node.has("contains")) {
            return new RuleMatch.Contains(node.get("contains").asText());
        } else if (node.has("regex")) {
            return new RuleMatch.Regex(node.get("regex").asText());
        }
        throw new RuleSetLoadException("Rule '%s': unknown match format: %s".formatted(rule, node), source, null);
    }

    private static Explanation parseExplanation(JsonNode node, String rule, String source) {
        if (node == null) {
            throw new RuleSetLoadException("Rule '%s' has no 'explanation'".formatted(rule), source, null);
        }
        if (node.isTextual()) {
            return Explanation.of(node.asText());
        }
        if (!node.has("concise")) {
            throw new RuleSetLoadException(
                "Rule '%s': explanation needs a 'concise' variant".formatted(rule), source, null);
        }
        return new Explanation(
            node.get("concise").asText(),
            node.has("detailed") ? node.get("detailed").asText() : null,
            node.has("teacher") ? node.get("teacher").asText() : null);
    }

    private static String text(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new RuleSetLoadException("Missing required field '%s'".formatted(field), source, null);
        }
        return value.asText();
    }
}
