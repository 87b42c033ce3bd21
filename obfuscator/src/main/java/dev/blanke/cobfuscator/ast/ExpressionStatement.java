package dev.blanke.cobfuscator.ast;

import org.jetbrains.annotations.Nullable;

/**
 * An expression evaluated for its side effects, or the null statement {@code ;} if {@code expression} is
 * {@code null}.
 */
public record ExpressionStatement(@Nullable Expression expression) implements Statement {

    public static ExpressionStatement empty() {
        return new ExpressionStatement(null);
    }

    public boolean isEmpty() {
        return expression == null;
    }
}
