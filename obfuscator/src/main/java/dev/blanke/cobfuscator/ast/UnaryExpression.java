package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {

    public UnaryExpression {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(operand);
    }
}
