package dev.stepwise.rule;

import dev.stepwise.error.DuplicateRuleNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All rules known to the process, grouped by operation.
 *
 * <p>Populated once at startup, then {@linkplain #lock() locked}. Ordering for an operation is
 * descending priority, then registration order.
 *
 * <p>Registration is not thread-safe. After {@link #lock()} the registry is immutable and
 * {@link #rulesFor} may be called from any number of threads.
 */
public final class RuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistry.class);

    private static final Comparator<Rule> BY_PRIORITY_DESC =
        Comparator.comparingInt(Rule::priority).reversed();

    private final Map<String, List<Rule>> byOperation = new LinkedHashMap<>();
    private final Set<String> keys = new HashSet<>();
    private volatile Map<String, List<Rule>> snapshot;

    /**
     * Add a rule.
     *
     * @throws DuplicateRuleNameException if the operation already has a rule with this name
     * @throws IllegalStateException      if the registry is locked
     */
    public RuleRegistry register(Rule rule) {
        if (snapshot != null) {
            throw new IllegalStateException("Rule registry is locked; cannot register " + rule.name());
        }
        if (!keys.add(rule.operation() + "\u0000" + rule.name())) {
            throw new DuplicateRuleNameException(rule.operation(), rule.name());
        }
        byOperation.computeIfAbsent(rule.operation(), op -> new ArrayList<>()).add(rule);
        LOG.debug("Registered rule {} for {} (priority {})", rule.name(), rule.operation(), rule.priority());
        return this;
    }

    public RuleRegistry registerAll(Iterable<? extends Rule> rules) {
        for (Rule rule : rules) {
            register(rule);
        }
        return this;
    }

    /**
     * Freeze the registry and precompute per-operation ordering. Idempotent.
     */
    public synchronized void lock() {
        if (snapshot != null) {
            return;
        }
        var frozen = new LinkedHashMap<String, List<Rule>>();
        byOperation.forEach((op, rules) -> frozen.put(op, ordered(rules)));
        snapshot = Map.copyOf(frozen);
        LOG.debug("Rule registry locked with {} rules across {} operations", keys.size(), frozen.size());
    }

    public boolean isLocked() {
        return snapshot != null;
    }

    /**
     * Rules for an operation, highest priority first, ties in registration order. Unknown
     * operations give an empty list.
     */
    public List<Rule> rulesFor(String operation) {
        Map<String, List<Rule>> frozen = snapshot;
        if (frozen != null) {
            return frozen.getOrDefault(operation, List.of());
        }
        return ordered(byOperation.getOrDefault(operation, List.of()));
    }

    /** Operations with at least one rule, in first-registration order. */
    public Set<String> operations() {
        return new LinkedHashSet<>(byOperation.keySet());
    }

    public List<String> ruleNames(String operation) {
        return rulesFor(operation).stream().map(Rule::name).toList();
    }

    public int size() {
        return keys.size();
    }

    private static List<Rule> ordered(List<Rule> rules) {
        var sorted = new ArrayList<>(rules);
        // List.sort is stable, so equal priorities keep registration order
        sorted.sort(BY_PRIORITY_DESC);
        return List.copyOf(sorted);
    }
}
