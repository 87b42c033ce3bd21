package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record SubscriptExpression(Expression array, Expression index) implements Expression {

    public SubscriptExpression {
        Objects.requireNonNull(array);
        Objects.requireNonNull(index);
    }
}
