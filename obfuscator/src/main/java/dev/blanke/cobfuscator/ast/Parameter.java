package dev.blanke.cobfuscator.ast;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A parameter of a {@link FunctionType}.
 *
 * @param name The parameter name, which may be omitted in prototypes.
 *
 * @param type The declared type of the parameter.
 */
public record Parameter(@Nullable String name, CType type) implements Node {

    public Parameter {
        Objects.requireNonNull(type);
    }
}
