package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record PointerType(CType target) implements CType {

    public PointerType {
        Objects.requireNonNull(target);
    }
}
