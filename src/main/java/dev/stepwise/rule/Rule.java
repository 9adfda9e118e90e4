package dev.stepwise.rule;

import java.util.Set;

/**
 * A named, prioritized transformation for one operation.
 *
 * <p>Both {@link #isApplicable} and {@link #apply} must be deterministic: same expression in,
 * same answer out, no clocks, no randomness, no state carried between calls. The engine stops
 * as soon as no rule reports itself applicable, so an applicable rule must move the expression
 * towards a state where it no longer applies.
 */
public interface Rule {

    /** Unique within {@link #operation()}. */
    String name();

    /** The operation this rule belongs to, e.g. {@code differentiate}. */
    String operation();

    /** Higher fires first among rules applicable to the same expression. */
    int priority();

    /** Applicability tags such as {@code calculus}; used only for optional filtering. */
    Set<String> domains();

    boolean isApplicable(String expression);

    /**
     * Transform the expression.
     *
     * @param expression the current expression in provider-rendered form
     * @param context    operation, variable and the steps recorded so far
     * @return the new expression with its explanation, dependencies and metadata
     */
    RuleOutcome apply(String expression, RuleContext context);
}
