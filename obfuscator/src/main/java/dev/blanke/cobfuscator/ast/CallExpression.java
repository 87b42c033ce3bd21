package dev.blanke.cobfuscator.ast;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

public record CallExpression(Expression callee, List<Expression> arguments) implements Expression {

    public CallExpression {
        Objects.requireNonNull(callee);
        arguments = List.copyOf(arguments);
    }

    /**
     * @return The name of the called function if the callee is a plain identifier, otherwise {@code null}.
     */
    public @Nullable String calleeName() {
        return (callee instanceof Identifier identifier) ? identifier.name() : null;
    }
}
