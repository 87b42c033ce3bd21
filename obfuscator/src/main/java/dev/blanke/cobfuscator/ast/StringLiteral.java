package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A string literal in its source spelling including the quotes and escape sequences.
 */
public record StringLiteral(String text) implements Expression {

    public StringLiteral {
        Objects.requireNonNull(text);
    }
}
