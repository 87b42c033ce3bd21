package dev.blanke.cobfuscator.analysis.expression;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;

/**
 * What the {@link ExpressionAnalyzer} inferred about a single expression.
 *
 * @param type The type of the value of the expression with typedef names expanded and top-level qualifiers removed,
 *             or {@code null} if the type could not be determined.
 *
 * @param effect The effect of evaluating the expression.
 */
public record ExpressionInfo(@Nullable CType type, Effect effect) {

    public ExpressionInfo {
        Objects.requireNonNull(effect);
    }

    /**
     * @return The arithmetic type of the expression, or {@code null} if it does not have a known arithmetic type.
     */
    public @Nullable Primitive arithmeticType() {
        return ((type instanceof PrimitiveType primitive) && primitive.primitive().isArithmetic())
            ? primitive.primitive() : null;
    }

    public boolean isInteger() {
        final var arithmetic = arithmeticType();
        return arithmetic != null && arithmetic.isInteger();
    }

    public boolean isFloating() {
        final var arithmetic = arithmeticType();
        return arithmetic != null && arithmetic.isFloating();
    }
}
