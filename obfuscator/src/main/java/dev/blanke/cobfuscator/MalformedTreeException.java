package dev.blanke.cobfuscator;

/**
 * Thrown if a syntax tree violates a constraint the C compiler would reject it for, such as a {@code break} outside
 * of any loop or {@code switch} statement or a {@code goto} to an undefined label.
 *
 * @implNote Cannot be a checked {@link Exception}, as it is thrown from within overridden
 *           {@link dev.blanke.cobfuscator.ast.TreeVisitor} methods.
 */
public final class MalformedTreeException extends RuntimeException {

    public MalformedTreeException(final String message) {
        super(message);
    }
}
