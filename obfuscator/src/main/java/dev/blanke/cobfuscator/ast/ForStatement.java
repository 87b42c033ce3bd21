package dev.blanke.cobfuscator.ast;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A {@code for} statement. Its header opens a scope of its own which encloses the loop body.
 *
 * @param declarations The declarations of the first clause, e.g. {@code int i = 0, j = 1}. Empty if the first clause
 *                     is an expression or omitted.
 *
 * @param initializer The expression of the first clause. Must be {@code null} if {@code declarations} is non-empty.
 *
 * @param condition The controlling expression; an omitted condition is always true.
 *
 * @param step The expression evaluated after each iteration.
 *
 * @param body The loop body.
 */
public record ForStatement(List<Declaration> declarations,
                           @Nullable Expression initializer,
                           @Nullable Expression condition,
                           @Nullable Expression step,
                           Statement body) implements Statement {

    public ForStatement {
        declarations = List.copyOf(declarations);
        if (!declarations.isEmpty() && initializer != null)
            throw new IllegalArgumentException("The first clause is either a declaration or an expression");
        Objects.requireNonNull(body);
    }
}
