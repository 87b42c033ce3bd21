package dev.blanke.cobfuscator.ast;

/**
 * The binary operators of C together with their precedence, where a higher number binds tighter. All binary
 * operators are left-associative.
 */
public enum BinaryOperator {

    MULTIPLY   ("*",  13),
    DIVIDE     ("/",  13),
    MODULO     ("%",  13),
    ADD        ("+",  12),
    SUBTRACT   ("-",  12),
    SHIFT_LEFT ("<<", 11),
    SHIFT_RIGHT(">>", 11),
    LESS         ("<",  10),
    GREATER      (">",  10),
    LESS_EQUAL   ("<=", 10),
    GREATER_EQUAL(">=", 10),
    EQUAL    ("==", 9),
    NOT_EQUAL("!=", 9),
    BITWISE_AND("&",  8),
    BITWISE_XOR("^",  7),
    BITWISE_OR ("|",  6),
    LOGICAL_AND("&&", 5),
    LOGICAL_OR ("||", 4);

    private final String token;

    private final int precedence;

    BinaryOperator(final String token, final int precedence) {
        this.token      = token;
        this.precedence = precedence;
    }

    public String getToken() {
        return token;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 10 || precedence == 9;
    }

    public boolean isLogical() {
        return this == LOGICAL_AND || this == LOGICAL_OR;
    }

    public boolean isShift() {
        return this == SHIFT_LEFT || this == SHIFT_RIGHT;
    }

    /**
     * Returns the comparison operator yielding the opposite result for the same operands.
     *
     * @throws IllegalStateException If this is not a comparison operator.
     */
    public BinaryOperator negateComparison() {
        return switch (this) {
            case LESS          -> GREATER_EQUAL;
            case GREATER       -> LESS_EQUAL;
            case LESS_EQUAL    -> GREATER;
            case GREATER_EQUAL -> LESS;
            case EQUAL         -> NOT_EQUAL;
            case NOT_EQUAL     -> EQUAL;
            default -> throw new IllegalStateException(this + " is not a comparison");
        };
    }
}
