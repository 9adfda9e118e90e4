package dev.stepwise.error;

import dev.stepwise.model.StepGraph;

/**
 * The iteration cap was reached while a rule still reported itself applicable. Carries the
 * sealed partial graph so the offending loop can be inspected.
 */
public final class NonConvergenceException extends StepInputException {

    private static final long serialVersionUID = 1L;

    private final transient StepGraph partialGraph;
    private final int maxIterations;

    public NonConvergenceException(String operation, int maxIterations, StepGraph partialGraph) {
        super("Operation '%s' did not converge within %d rule applications"
            .formatted(operation, maxIterations));
        this.partialGraph = partialGraph;
        this.maxIterations = maxIterations;
    }

    public StepGraph partialGraph() {
        return partialGraph;
    }

    public int maxIterations() {
        return maxIterations;
    }
}
