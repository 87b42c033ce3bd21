package dev.blanke.cobfuscator.ast;

/**
 * The basic types of C.
 * <p>
 * Sizes follow the LP64 data model used by mainstream 64-bit Unix compilers, and plain {@code char} is signed.
 */
public enum Primitive {

    VOID("void", 0, 0, false),

    BOOL              ("_Bool",              1, 1, false),
    CHAR              ("char",               2, 1, true),
    SIGNED_CHAR       ("signed char",        2, 1, true),
    UNSIGNED_CHAR     ("unsigned char",      2, 1, false),
    SHORT             ("short",              3, 2, true),
    UNSIGNED_SHORT    ("unsigned short",     3, 2, false),
    INT               ("int",                4, 4, true),
    UNSIGNED_INT      ("unsigned int",       4, 4, false),
    LONG              ("long",               5, 8, true),
    UNSIGNED_LONG     ("unsigned long",      5, 8, false),
    LONG_LONG         ("long long",          6, 8, true),
    UNSIGNED_LONG_LONG("unsigned long long", 6, 8, false),

    FLOAT      ("float",       0, 4,  true),
    DOUBLE     ("double",      0, 8,  true),
    LONG_DOUBLE("long double", 0, 16, true);

    private final String spelling;

    /**
     * The integer conversion rank, or {@code 0} for types which are not integer types.
     */
    private final int rank;

    private final int size;

    private final boolean signed;

    Primitive(final String spelling, final int rank, final int size, final boolean signed) {
        this.spelling = spelling;
        this.rank     = rank;
        this.size     = size;
        this.signed   = signed;
    }

    public String getSpelling() {
        return spelling;
    }

    public int getRank() {
        return rank;
    }

    public int getSize() {
        return size;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isInteger() {
        return rank > 0;
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE || this == LONG_DOUBLE;
    }

    public boolean isArithmetic() {
        return isInteger() || isFloating();
    }

    /**
     * Returns the unsigned integer type corresponding to this integer type.
     *
     * @return The unsigned counterpart of this type, or this type itself if it is already unsigned.
     *
     * @throws IllegalStateException If this is not an integer type.
     */
    public Primitive toUnsigned() {
        return switch (this) {
            case BOOL, UNSIGNED_CHAR, UNSIGNED_SHORT, UNSIGNED_INT, UNSIGNED_LONG, UNSIGNED_LONG_LONG -> this;
            case CHAR, SIGNED_CHAR -> UNSIGNED_CHAR;
            case SHORT     -> UNSIGNED_SHORT;
            case INT       -> UNSIGNED_INT;
            case LONG      -> UNSIGNED_LONG;
            case LONG_LONG -> UNSIGNED_LONG_LONG;
            case VOID, FLOAT, DOUBLE, LONG_DOUBLE -> throw new IllegalStateException(this + " is not an integer type");
        };
    }
}
