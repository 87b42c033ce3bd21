package dev.blanke.cobfuscator.analysis.expression;

import dev.blanke.cobfuscator.ast.Primitive;

/**
 * A utility class implementing the integer promotions and the usual arithmetic conversions of C.
 */
public final class ArithmeticConversions {

    // Prevent instantiation of utility class.
    private ArithmeticConversions() {
    }

    /**
     * Applies the integer promotions: every integer type ranked below {@code int} is promoted to {@code int}, which can
     * represent all of its values.
     */
    public static Primitive promote(final Primitive type) {
        return (type.isInteger() && type.getRank() < Primitive.INT.getRank()) ? Primitive.INT : type;
    }

    /**
     * Determines the common type of the operands of a binary arithmetic operator.
     */
    public static Primitive usualArithmeticConversion(final Primitive left, final Primitive right) {
        if (!left.isArithmetic() || !right.isArithmetic())
            throw new IllegalArgumentException("Operands must be arithmetic: " + left + ", " + right);
        for (final var floating : new Primitive[] { Primitive.LONG_DOUBLE, Primitive.DOUBLE, Primitive.FLOAT })
            if (left == floating || right == floating)
                return floating;

        final var promotedLeft  = promote(left);
        final var promotedRight = promote(right);
        if (promotedLeft == promotedRight)
            return promotedLeft;
        if (promotedLeft.isSigned() == promotedRight.isSigned())
            return (promotedLeft.getRank() >= promotedRight.getRank()) ? promotedLeft : promotedRight;

        final var unsigned = promotedLeft.isSigned() ? promotedRight : promotedLeft;
        final var signed   = promotedLeft.isSigned() ? promotedLeft  : promotedRight;
        if (unsigned.getRank() >= signed.getRank())
            return unsigned;
        // The signed type can represent all values of the unsigned one only if it is wider.
        if (signed.getSize() > unsigned.getSize())
            return signed;
        return signed.toUnsigned();
    }
}
