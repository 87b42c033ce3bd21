package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record IndexDesignator(Expression index) implements Designator {

    public IndexDesignator {
        Objects.requireNonNull(index);
    }
}
