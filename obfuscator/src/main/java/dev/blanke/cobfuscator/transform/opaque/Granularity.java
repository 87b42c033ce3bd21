package dev.blanke.cobfuscator.transform.opaque;

/**
 * The extent of the code guarded by an inserted opaque predicate.
 */
public enum Granularity {

    PROCEDURAL,

    BLOCK,

    STATEMENT
}
