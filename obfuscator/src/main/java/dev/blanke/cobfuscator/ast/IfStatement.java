package dev.blanke.cobfuscator.ast;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

public record IfStatement(Expression condition, Statement thenStatement, @Nullable Statement elseStatement)
        implements Statement {

    public IfStatement {
        Objects.requireNonNull(condition);
        Objects.requireNonNull(thenStatement);
    }

    public IfStatement(final Expression condition, final Statement thenStatement) {
        this(condition, thenStatement, null);
    }
}
