package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record SwitchStatement(Expression selector, Statement body) implements Statement {

    public SwitchStatement {
        Objects.requireNonNull(selector);
        Objects.requireNonNull(body);
    }
}
