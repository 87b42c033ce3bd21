package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record BinaryExpression(BinaryOperator operator, Expression left, Expression right) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
    }
}
