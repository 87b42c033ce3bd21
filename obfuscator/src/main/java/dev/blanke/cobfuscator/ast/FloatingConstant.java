package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record FloatingConstant(String text) implements Expression {

    public FloatingConstant {
        Objects.requireNonNull(text);
    }
}
