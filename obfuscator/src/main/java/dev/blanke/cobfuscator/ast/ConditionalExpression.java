package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record ConditionalExpression(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {

    public ConditionalExpression {
        Objects.requireNonNull(condition);
        Objects.requireNonNull(whenTrue);
        Objects.requireNonNull(whenFalse);
    }
}
