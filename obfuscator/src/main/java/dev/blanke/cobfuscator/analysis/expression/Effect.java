package dev.blanke.cobfuscator.analysis.expression;

/**
 * Classifies what evaluating an expression may do besides computing its value, ordered from least to most
 * restrictive. Combining the effects of subexpressions yields the more restrictive one.
 */
public enum Effect {

    /**
     * Evaluation reads automatic variables and constants only.
     */
    PURE,

    /**
     * Evaluation reads objects with static storage duration or memory through pointers, whose values other code may
     * change. Such expressions can be evaluated repeatedly, but not moved across writes.
     */
    READS_GLOBAL,

    HAS_SIDE_EFFECT,

    /**
     * Evaluation may do anything, e.g. call a function the analysis cannot see into. Must be treated like
     * {@link #HAS_SIDE_EFFECT}.
     */
    UNKNOWN;

    public Effect combine(final Effect other) {
        return (other.ordinal() > ordinal()) ? other : this;
    }

    public boolean isPure() {
        return this == PURE;
    }

    /**
     * @return Whether evaluating the expression any number of times is indistinguishable from evaluating it once.
     */
    public boolean isSideEffectFree() {
        return this == PURE || this == READS_GLOBAL;
    }
}
