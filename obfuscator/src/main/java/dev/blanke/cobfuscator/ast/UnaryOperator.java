package dev.blanke.cobfuscator.ast;

public enum UnaryOperator {

    PLUS          ("+"),
    NEGATE        ("-"),
    BITWISE_NOT   ("~"),
    LOGICAL_NOT   ("!"),
    ADDRESS_OF    ("&"),
    DEREFERENCE   ("*"),
    PRE_INCREMENT ("++"),
    PRE_DECREMENT ("--"),
    POST_INCREMENT("++"),
    POST_DECREMENT("--"),
    SIZEOF        ("sizeof");

    private final String token;

    UnaryOperator(final String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public boolean isPostfix() {
        return this == POST_INCREMENT || this == POST_DECREMENT;
    }

    /**
     * @return Whether applying this operator modifies its operand.
     */
    public boolean isModifying() {
        return this == PRE_INCREMENT || this == PRE_DECREMENT || this == POST_INCREMENT || this == POST_DECREMENT;
    }
}
