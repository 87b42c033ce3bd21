package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record DoWhileStatement(Statement body, Expression condition) implements Statement {

    public DoWhileStatement {
        Objects.requireNonNull(body);
        Objects.requireNonNull(condition);
    }
}
