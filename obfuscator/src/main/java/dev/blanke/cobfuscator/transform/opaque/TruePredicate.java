package dev.blanke.cobfuscator.transform.opaque;

import java.util.function.Supplier;

import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Trees;

/**
 * The catalogue of predicates which are true for all values of their variables.
 * <p>
 * Every variable is read through a cast to {@code unsigned int}, so all arithmetic is carried out modulo 2<sup>32</sup>
 * and cannot overflow. Each identity only depends on the residue of its operands modulo a power of two, which that
 * arithmetic preserves.
 */
public enum TruePredicate {

    /**
     * {@code (x * (x + 1) & 1) == 0}: the product of two consecutive integers is even.
     */
    CONSECUTIVE_PRODUCT_EVEN(1) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return equal(and(multiply(x.get(), add(x.get(), Trees.unsigned(1))), 1), 0);
        }
    },

    /**
     * {@code (x * x & 3) != 2}: squares are congruent to 0 or 1 modulo 4.
     */
    SQUARE_NOT_TWO_MOD_FOUR(1) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return notEqual(and(multiply(x.get(), x.get()), 3), 2);
        }
    },

    /**
     * {@code (x * x & 3) != 3}
     */
    SQUARE_NOT_THREE_MOD_FOUR(1) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return notEqual(and(multiply(x.get(), x.get()), 3), 3);
        }
    },

    /**
     * {@code ((x | 1) * (x | 1) & 7) == 1}: odd squares are congruent to 1 modulo 8.
     */
    ODD_SQUARE_ONE_MOD_EIGHT(1) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return equal(and(multiply(or(x.get(), 1), or(x.get(), 1)), 7), 1);
        }
    },

    /**
     * {@code (x * (x + 1) * (x + 2) * (x + 3) & 7) == 0}: the product of four consecutive integers is divisible by 24.
     */
    CONSECUTIVE_QUADRUPLE_PRODUCT(1) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            final var product = multiply(multiply(multiply(x.get(), add(x.get(), Trees.unsigned(1))),
                add(x.get(), Trees.unsigned(2))), add(x.get(), Trees.unsigned(3)));
            return equal(and(product, 7), 0);
        }
    },

    /**
     * {@code 7 * (y * y) != x * x + 1}: modulo 8 the left side is one of 0, 4 and 7, the right side one of 1, 2 and 5.
     */
    SEVEN_SQUARES(2) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return Trees.binary(BinaryOperator.NOT_EQUAL,
                multiply(Trees.unsigned(7), multiply(y.get(), y.get())),
                add(multiply(x.get(), x.get()), Trees.unsigned(1)));
        }
    },

    /**
     * {@code (x * x + y * y & 3) != 3}: sums of two squares are never congruent to 3 modulo 4.
     */
    SUM_OF_SQUARES(2) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return notEqual(and(add(multiply(x.get(), x.get()), multiply(y.get(), y.get())), 3), 3);
        }
    },

    /**
     * {@code (x * x - y * y & 3) != 2}: differences of two squares are never congruent to 2 modulo 4.
     */
    DIFFERENCE_OF_SQUARES(2) {
        @Override
        public Expression build(final Supplier<Expression> x, final Supplier<Expression> y) {
            return notEqual(and(Trees.binary(BinaryOperator.SUBTRACT, multiply(x.get(), x.get()),
                multiply(y.get(), y.get())), 3), 2);
        }
    };

    private final int arity;

    TruePredicate(final int arity) {
        this.arity = arity;
    }

    /**
     * @return The number of distinct variables the predicate is built from.
     */
    public int getArity() {
        return arity;
    }

    /**
     * Builds the predicate.
     *
     * @param x Creates a fresh {@code unsigned int} operand each time it is called.
     *
     * @param y Like {@code x}, for the second variable. Unused by predicates of arity 1.
     */
    public abstract Expression build(Supplier<Expression> x, Supplier<Expression> y);

    private static Expression add(final Expression left, final Expression right) {
        return Trees.binary(BinaryOperator.ADD, left, right);
    }

    private static Expression multiply(final Expression left, final Expression right) {
        return Trees.binary(BinaryOperator.MULTIPLY, left, right);
    }

    private static Expression and(final Expression left, final long mask) {
        return Trees.binary(BinaryOperator.BITWISE_AND, left, Trees.unsigned(mask));
    }

    private static Expression or(final Expression left, final long mask) {
        return Trees.binary(BinaryOperator.BITWISE_OR, left, Trees.unsigned(mask));
    }

    private static Expression equal(final Expression left, final long value) {
        return Trees.binary(BinaryOperator.EQUAL, left, Trees.unsigned(value));
    }

    private static Expression notEqual(final Expression left, final long value) {
        return Trees.binary(BinaryOperator.NOT_EQUAL, left, Trees.unsigned(value));
    }
}
