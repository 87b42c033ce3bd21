package dev.blanke.cobfuscator.ast;

import org.jetbrains.annotations.Nullable;

public enum AssignmentOperator {

    ASSIGN            ("=",   null),
    MULTIPLY_ASSIGN   ("*=",  BinaryOperator.MULTIPLY),
    DIVIDE_ASSIGN     ("/=",  BinaryOperator.DIVIDE),
    MODULO_ASSIGN     ("%=",  BinaryOperator.MODULO),
    ADD_ASSIGN        ("+=",  BinaryOperator.ADD),
    SUBTRACT_ASSIGN   ("-=",  BinaryOperator.SUBTRACT),
    SHIFT_LEFT_ASSIGN ("<<=", BinaryOperator.SHIFT_LEFT),
    SHIFT_RIGHT_ASSIGN(">>=", BinaryOperator.SHIFT_RIGHT),
    AND_ASSIGN        ("&=",  BinaryOperator.BITWISE_AND),
    XOR_ASSIGN        ("^=",  BinaryOperator.BITWISE_XOR),
    OR_ASSIGN         ("|=",  BinaryOperator.BITWISE_OR);

    private final String token;

    /**
     * The operator applied by a compound assignment, {@code null} for simple assignment.
     */
    private final @Nullable BinaryOperator binaryOperator;

    AssignmentOperator(final String token, final @Nullable BinaryOperator binaryOperator) {
        this.token          = token;
        this.binaryOperator = binaryOperator;
    }

    public String getToken() {
        return token;
    }

    public @Nullable BinaryOperator getBinaryOperator() {
        return binaryOperator;
    }
}
