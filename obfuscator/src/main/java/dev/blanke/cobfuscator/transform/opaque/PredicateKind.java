package dev.blanke.cobfuscator.transform.opaque;

/**
 * The shape of the construct built around the guarded code {@code S}.
 */
public enum PredicateKind {

    /**
     * {@code if (true) { S }}
     */
    CHECK,

    /**
     * {@code if (false) { buggy } S}
     */
    FALSE,

    /**
     * {@code if (true) { S } else { buggy }}
     */
    ELSE_TRUE,

    /**
     * {@code if (false) { buggy } else { S }}
     */
    ELSE_FALSE,

    /**
     * {@code while (false) { buggy } S}
     */
    WHILE_FALSE,

    /**
     * {@code if (either) { S } else { S' }}, where {@code S'} is a copy of {@code S}.
     */
    EITHER
}
