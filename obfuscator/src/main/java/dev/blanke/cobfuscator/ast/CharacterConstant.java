package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A character constant in its source spelling including the quotes, e.g. {@code 'a'} or {@code '\n'}.
 */
public record CharacterConstant(String text) implements Expression {

    public CharacterConstant {
        Objects.requireNonNull(text);
    }
}
