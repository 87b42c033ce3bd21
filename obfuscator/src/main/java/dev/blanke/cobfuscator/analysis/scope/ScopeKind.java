package dev.blanke.cobfuscator.analysis.scope;

public enum ScopeKind {

    FILE,

    /**
     * The scope shared by the parameters of a function definition and the outermost block of its body.
     */
    FUNCTION,

    BLOCK,

    /**
     * The scope opened by the header of a {@code for} statement.
     */
    FOR,

    /**
     * The scope of the parameter names of a function declarator which is not part of a definition.
     */
    PROTOTYPE,

    /**
     * The member list of a single structure or union.
     */
    AGGREGATE
}
