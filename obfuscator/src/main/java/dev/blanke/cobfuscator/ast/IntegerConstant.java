package dev.blanke.cobfuscator.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * An integer constant, kept in its source spelling so that octal, hexadecimal and suffixed constants survive
 * untouched. Integer constants are never negative; negative values are expressed with a unary minus.
 *
 * @param text The source spelling, e.g. {@code 42}, {@code 0x2Au} or {@code 052L}.
 */
public record IntegerConstant(String text) implements Expression {

    public IntegerConstant {
        Objects.requireNonNull(text);
        if (text.isEmpty() || !Character.isDigit(text.charAt(0)))
            throw new IllegalArgumentException("Malformed integer constant: " + text);
    }

    public static IntegerConstant of(final long value) {
        if (value < 0)
            throw new IllegalArgumentException("Integer constants are non-negative: " + value);
        return new IntegerConstant(Long.toString(value));
    }

    /**
     * @return The suffix of this constant in lower case, e.g. {@code "ul"}, or an empty string.
     */
    public String suffix() {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0)
            end--;
        return text.substring(end).toLowerCase(Locale.ROOT);
    }

    /**
     * @return Whether the constant is written in decimal notation.
     */
    public boolean isDecimal() {
        return text.length() == suffix().length() + 1 || text.charAt(0) != '0';
    }

    /**
     * Parses the value of this constant. Values above {@link Long#MAX_VALUE} wrap around, as they would when stored in
     * an {@code unsigned long long}.
     *
     * @return The value of this constant as a 64-bit two's complement number.
     */
    public long value() {
        final var digits = text.substring(0, text.length() - suffix().length());
        if (digits.startsWith("0x") || digits.startsWith("0X"))
            return Long.parseUnsignedLong(digits.substring(2), 16);
        if (digits.startsWith("0b") || digits.startsWith("0B"))
            return Long.parseUnsignedLong(digits.substring(2), 2);
        if (digits.length() > 1 && digits.charAt(0) == '0')
            return Long.parseUnsignedLong(digits.substring(1), 8);
        return Long.parseUnsignedLong(digits);
    }
}
