package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record LabeledStatement(String label, Statement body) implements Statement {

    public LabeledStatement {
        Objects.requireNonNull(label);
        Objects.requireNonNull(body);
    }
}
