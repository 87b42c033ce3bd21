package dev.blanke.cobfuscator.ast;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

public record Enumerator(String name, @Nullable Expression value) implements Node {

    public Enumerator {
        Objects.requireNonNull(name);
    }
}
