package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A reference to a type declared by a {@link TypedefDeclaration}.
 *
 * @param name The declared name of the typedef.
 */
public record TypedefName(String name) implements CType {

    public TypedefName {
        Objects.requireNonNull(name);
    }
}
