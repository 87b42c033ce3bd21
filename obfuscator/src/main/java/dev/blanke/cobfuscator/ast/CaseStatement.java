package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A {@code case} label together with the statement it labels. Like all labels, it does not introduce a scope: the
 * labeled statement is just an entry point into the body of the enclosing {@link SwitchStatement}.
 */
public record CaseStatement(Expression value, Statement body) implements Statement {

    public CaseStatement {
        Objects.requireNonNull(value);
        Objects.requireNonNull(body);
    }
}
