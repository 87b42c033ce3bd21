package dev.blanke.cobfuscator.transform.opaque;

/**
 * Where the variables governing an opaque predicate come from.
 */
public enum PredicateStyle {

    /**
     * Integer parameters and initialized local variables visible at the insertion point.
     */
    DYNAMIC_INPUT,

    /**
     * Fresh local variables holding random values, declared at the start of the enclosing function.
     */
    ENTROPIC
}
