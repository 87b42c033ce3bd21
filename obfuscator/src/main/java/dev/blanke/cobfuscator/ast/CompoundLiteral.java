package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record CompoundLiteral(CType type, InitializerList initializer) implements Expression {

    public CompoundLiteral {
        Objects.requireNonNull(type);
        Objects.requireNonNull(initializer);
    }
}
