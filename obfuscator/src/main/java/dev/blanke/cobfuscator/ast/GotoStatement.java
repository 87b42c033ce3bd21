package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record GotoStatement(String label) implements Statement {

    public GotoStatement {
        Objects.requireNonNull(label);
    }
}
