package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record PrimitiveType(Primitive primitive) implements CType {

    public PrimitiveType {
        Objects.requireNonNull(primitive);
    }

    public static PrimitiveType of(final Primitive primitive) {
        return new PrimitiveType(primitive);
    }
}
