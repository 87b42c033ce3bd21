package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

import dev.blanke.cobfuscator.ast.Expression;

public record Branch(Expression condition, int whenTrue, int whenFalse) implements Terminator {

    public Branch {
        Objects.requireNonNull(condition);
    }

    @Override
    public List<Integer> successors() {
        return List.of(whenTrue, whenFalse);
    }

    @Override
    public Branch remap(final IntUnaryOperator ids) {
        return new Branch(condition, ids.applyAsInt(whenTrue), ids.applyAsInt(whenFalse));
    }
}
