package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record SizeofTypeExpression(CType type) implements Expression {

    public SizeofTypeExpression {
        Objects.requireNonNull(type);
    }
}
