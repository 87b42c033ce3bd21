package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record WhileStatement(Expression condition, Statement body) implements Statement {

    public WhileStatement {
        Objects.requireNonNull(condition);
        Objects.requireNonNull(body);
    }
}
