package dev.blanke.cobfuscator.transform;

import java.util.Random;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;

import static dev.blanke.cobfuscator.ast.BinaryOperator.ADD;
import static dev.blanke.cobfuscator.ast.BinaryOperator.BITWISE_AND;
import static dev.blanke.cobfuscator.ast.BinaryOperator.BITWISE_OR;
import static dev.blanke.cobfuscator.ast.BinaryOperator.BITWISE_XOR;
import static dev.blanke.cobfuscator.ast.BinaryOperator.MULTIPLY;
import static dev.blanke.cobfuscator.ast.BinaryOperator.SUBTRACT;

/**
 * Replaces integer arithmetic with equivalent mixed boolean-arithmetic expressions, e.g. {@code x + y} with
 * {@code (x ^ y) + 2 * (x & y)}.
 * <p>
 * The rewritten expression computes in the unsigned counterpart of the result type, whose arithmetic wraps around
 * instead of overflowing, and converts the result back. Since each operand is evaluated several times by the
 * rewritten expression, only operations on side-effect-free operands are rewritten.
 */
public final class ArithmeticEncoding implements Transform {

    private final int depth;

    /**
     * @param depth How many times the operations introduced by an encoding are encoded again.
     */
    public ArithmeticEncoding(final int depth) {
        this.depth = depth;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return new EncodingTransformer(unit, random).transform();
    }

    private final class EncodingTransformer extends ObfuscatingTransformer {

        EncodingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
        }

        /**
         * @return The type the encoding of the passed expression computes in, or {@code null} if it cannot be encoded.
         */
        private @Nullable Primitive encodingType(final Expression expression, final Expression... operands) {
            final var info = infoOf(expression);
            if (info == null || !info.isInteger() || info.arithmeticType().getRank() < Primitive.INT.getRank())
                return null;
            for (final var operand : operands) {
                final var operandInfo = infoOf(operand);
                if (operandInfo == null || !operandInfo.isInteger() || !operandInfo.effect().isSideEffectFree())
                    return null;
            }
            return info.arithmeticType().toUnsigned();
        }

        @Override
        public Expression transformBinaryExpression(final BinaryExpression expression) {
            final var transformed = (BinaryExpression) super.transformBinaryExpression(expression);
            final var operator = expression.operator();
            if (operator != ADD && operator != SUBTRACT && operator != BITWISE_XOR && operator != BITWISE_OR
                    && operator != BITWISE_AND)
                return transformed;
            final var type = encodingType(expression, expression.left(), expression.right());
            if (type == null)
                return transformed;

            final var result = encode(operator, Trees.cast(type, transformed.left()),
                Trees.cast(type, transformed.right()), depth);
            return Trees.cast(infoOf(expression).arithmeticType(), result);
        }

        @Override
        public Expression transformUnaryExpression(final UnaryExpression expression) {
            final var transformed = (UnaryExpression) super.transformUnaryExpression(expression);
            if (expression.operator() != UnaryOperator.NEGATE && expression.operator() != UnaryOperator.BITWISE_NOT)
                return transformed;
            final var type = encodingType(expression, expression.operand());
            if (type == null)
                return transformed;

            final var operand = Trees.cast(type, transformed.operand());
            final var result = (expression.operator() == UnaryOperator.NEGATE)
                // -x == ~x + 1
                ? encode(ADD, new UnaryExpression(UnaryOperator.BITWISE_NOT, operand), Trees.unsigned(1), depth - 1)
                // ~x == -x - 1
                : encode(SUBTRACT, new UnaryExpression(UnaryOperator.NEGATE, operand), Trees.unsigned(1), depth - 1);
            return Trees.cast(infoOf(expression).arithmeticType(), result);
        }

        /**
         * Builds an expression equivalent to {@code left operator right} over unsigned operands, encoding the
         * operations applied to the operands again until {@code depth} reaches zero. Both operands are used several
         * times and must therefore be free of side effects; every use but the first is a copy.
         */
        private Expression encode(final BinaryOperator operator, final Expression left, final Expression right,
                                  final int depth) {
            if (depth <= 0)
                return Trees.binary(operator, left, right);

            final var x  = left;
            final var y  = right;
            final var x2 = Trees.copy(left);
            final var y2 = Trees.copy(right);
            final var next = depth - 1;
            final var variant = random.nextInt(2);
            return switch (operator) {
                // x + y == (x ^ y) + 2 * (x & y) == (x | y) + (x & y)
                case ADD -> (variant == 0)
                    ? Trees.binary(ADD, encode(BITWISE_XOR, x, y, next),
                        Trees.binary(MULTIPLY, Trees.unsigned(2), encode(BITWISE_AND, x2, y2, next)))
                    : Trees.binary(ADD, encode(BITWISE_OR, x, y, next), encode(BITWISE_AND, x2, y2, next));
                // x - y == (x ^ y) - 2 * (~x & y) == x + ~y + 1
                case SUBTRACT -> (variant == 0)
                    ? Trees.binary(SUBTRACT, encode(BITWISE_XOR, x, y, next),
                        Trees.binary(MULTIPLY, Trees.unsigned(2),
                            encode(BITWISE_AND, new UnaryExpression(UnaryOperator.BITWISE_NOT, x2), y2, next)))
                    : Trees.binary(ADD, encode(ADD, x, new UnaryExpression(UnaryOperator.BITWISE_NOT, y), next),
                        Trees.unsigned(1));
                // x ^ y == (x | y) - (x & y)
                case BITWISE_XOR ->
                    Trees.binary(SUBTRACT, encode(BITWISE_OR, x, y, next), encode(BITWISE_AND, x2, y2, next));
                // x | y == (x & ~y) + y
                case BITWISE_OR -> Trees.binary(ADD,
                    encode(BITWISE_AND, x, new UnaryExpression(UnaryOperator.BITWISE_NOT, y), next), y2);
                // x & y == (x | y) - (x ^ y)
                case BITWISE_AND ->
                    Trees.binary(SUBTRACT, encode(BITWISE_OR, x, y, next), encode(BITWISE_XOR, x2, y2, next));
                default -> throw new IllegalArgumentException("Cannot encode " + operator);
            };
        }
    }
}
