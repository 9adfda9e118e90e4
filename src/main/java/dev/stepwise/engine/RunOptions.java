package dev.stepwise.engine;

import java.util.Set;

/**
 * Per-run options.
 *
 * @param domains when non-empty, only rules tagged with at least one of these domains are
 *                considered
 */
public record RunOptions(
    Set<String> domains
) {
    public RunOptions {
        domains = domains == null ? Set.of() : Set.copyOf(domains);
    }

    public static RunOptions defaults() {
        return new RunOptions(Set.of());
    }

    public static RunOptions forDomains(Set<String> domains) {
        return new RunOptions(domains);
    }

    boolean admits(Set<String> ruleDomains) {
        if (domains.isEmpty()) {
            return true;
        }
        for (String domain : ruleDomains) {
            if (domains.contains(domain)) {
                return true;
            }
        }
        return false;
    }
}
