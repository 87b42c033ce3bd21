package dev.blanke.cobfuscator.ast;

import java.util.Objects;

public record MemberDesignator(String name) implements Designator {

    public MemberDesignator {
        Objects.requireNonNull(name);
    }
}
