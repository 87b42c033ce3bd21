package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record DefaultStatement(Statement body) implements Statement {

    public DefaultStatement {
        Objects.requireNonNull(body);
    }
}
