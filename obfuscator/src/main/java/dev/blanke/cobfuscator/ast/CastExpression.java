package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record CastExpression(CType type, Expression operand) implements Expression {

    public CastExpression {
        Objects.requireNonNull(type);
        Objects.requireNonNull(operand);
    }
}
