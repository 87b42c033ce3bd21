package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record TypedefDeclaration(String name, CType type) implements ExternalDeclaration, BlockItem {

    public TypedefDeclaration {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
    }
}
