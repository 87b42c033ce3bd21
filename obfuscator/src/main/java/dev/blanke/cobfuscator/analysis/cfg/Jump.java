package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * An unconditional transfer of control, stemming from a {@code goto}, {@code break} or {@code continue} statement or
 * from the end of a loop body or conditional branch.
 */
public record Jump(int target) implements Terminator {

    @Override
    public List<Integer> successors() {
        return List.of(target);
    }

    @Override
    public Jump remap(final IntUnaryOperator ids) {
        return new Jump(ids.applyAsInt(target));
    }
}
