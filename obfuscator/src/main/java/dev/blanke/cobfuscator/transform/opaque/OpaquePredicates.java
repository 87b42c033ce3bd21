package dev.blanke.cobfuscator.transform.opaque;

import java.util.List;
import java.util.Random;

import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;

/**
 * Builds opaque predicates over named integer variables.
 */
public final class OpaquePredicates {

    private static final BinaryOperator[] COMPARISONS = {
        BinaryOperator.LESS,
        BinaryOperator.GREATER,
        BinaryOperator.LESS_EQUAL,
        BinaryOperator.GREATER_EQUAL,
        BinaryOperator.EQUAL,
        BinaryOperator.NOT_EQUAL
    };

    // Prevent instantiation of utility class.
    private OpaquePredicates() {
    }

    /**
     * Builds a predicate which is true whatever the values of the passed variables are.
     *
     * @param variables The names of integer variables, at least {@link TruePredicate#getArity()} many. Surplus names
     *                  are ignored.
     */
    public static Expression alwaysTrue(final TruePredicate form, final List<String> variables) {
        if (variables.size() < form.getArity())
            throw new IllegalArgumentException(form + " needs " + form.getArity() + " variables");
        final var x = variables.get(0);
        final var y = variables.get(form.getArity() - 1);
        return form.build(() -> operand(x), () -> operand(y));
    }

    /**
     * Builds a predicate which is false whatever the values of the passed variables are, as the negation of
     * {@link #alwaysTrue(TruePredicate, List)}.
     */
    public static Expression alwaysFalse(final TruePredicate form, final List<String> variables) {
        return negate(alwaysTrue(form, variables));
    }

    /**
     * Builds a predicate whose value depends on the passed variables, for constructs taking the same action either
     * way.
     *
     * @param variables The names of one or two integer variables.
     */
    public static Expression either(final Random random, final List<String> variables) {
        final var x = Trees.identifier(variables.get(0));
        return switch (random.nextInt((variables.size() > 1) ? 4 : 3)) {
            case 0  -> x;
            case 1  -> Trees.not(x);
            case 2  -> Trees.binary(comparison(random), x, Trees.integer(random.nextInt(51) - 25));
            default -> Trees.binary(comparison(random), x, Trees.identifier(variables.get(1)));
        };
    }

    /**
     * Negates a predicate structurally: comparisons are inverted, De Morgan's laws are applied to logical operators,
     * and a logical not is removed. Anything else is wrapped in a logical not.
     */
    public static Expression negate(final Expression predicate) {
        if (predicate instanceof BinaryExpression binary) {
            if (binary.operator().isComparison())
                return Trees.binary(binary.operator().negateComparison(), binary.left(), binary.right());
            if (binary.operator() == BinaryOperator.LOGICAL_AND)
                return Trees.binary(BinaryOperator.LOGICAL_OR, negate(binary.left()), negate(binary.right()));
            if (binary.operator() == BinaryOperator.LOGICAL_OR)
                return Trees.binary(BinaryOperator.LOGICAL_AND, negate(binary.left()), negate(binary.right()));
        }
        if (predicate instanceof UnaryExpression unary && unary.operator() == UnaryOperator.LOGICAL_NOT)
            return unary.operand();
        return Trees.not(predicate);
    }

    private static BinaryOperator comparison(final Random random) {
        return COMPARISONS[random.nextInt(COMPARISONS.length)];
    }

    private static Expression operand(final String variable) {
        return Trees.cast(Primitive.UNSIGNED_INT, Trees.identifier(variable));
    }
}
