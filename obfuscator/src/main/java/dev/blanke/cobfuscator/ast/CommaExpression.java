package dev.blanke.cobfuscator.ast;

import java.util.List;

public record CommaExpression(List<Expression> expressions) implements Expression {

    public CommaExpression {
        expressions = List.copyOf(expressions);
        if (expressions.size() < 2)
            throw new IllegalArgumentException("A comma expression has at least two operands");
    }
}
