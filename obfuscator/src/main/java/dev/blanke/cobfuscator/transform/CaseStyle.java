package dev.blanke.cobfuscator.transform;

/**
 * How {@link ControlFlowFlattening} labels the cases of the dispatching {@code switch} statement.
 */
public enum CaseStyle {

    /**
     * The ids of the basic blocks, {@code 0} to {@code n - 1}.
     */
    SEQUENTIAL,

    /**
     * Distinct random non-negative {@code int} values.
     */
    RANDOM_INT,

    /**
     * Enumeration constants with distinct random values, declared by an anonymous enumeration at the start of the
     * function.
     */
    ENUMERATOR
}
