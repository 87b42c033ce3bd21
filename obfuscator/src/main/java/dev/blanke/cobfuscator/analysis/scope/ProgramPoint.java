package dev.blanke.cobfuscator.analysis.scope;

import java.util.Objects;

/**
 * A point in the program, identified by the innermost scope enclosing it and its position in traversal order.
 */
public record ProgramPoint(Scope scope, int position) {

    public ProgramPoint {
        Objects.requireNonNull(scope);
    }
}
