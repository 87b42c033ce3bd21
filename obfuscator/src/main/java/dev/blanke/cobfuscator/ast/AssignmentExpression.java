package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record AssignmentExpression(AssignmentOperator operator, Expression target, Expression value) implements Expression {

    public AssignmentExpression {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(target);
        Objects.requireNonNull(value);
    }
}
