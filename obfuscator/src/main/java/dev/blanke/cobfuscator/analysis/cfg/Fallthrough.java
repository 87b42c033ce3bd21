package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Control continues in the block starting right after this one in the source.
 */
public record Fallthrough(int target) implements Terminator {

    @Override
    public List<Integer> successors() {
        return List.of(target);
    }

    @Override
    public Fallthrough remap(final IntUnaryOperator ids) {
        return new Fallthrough(ids.applyAsInt(target));
    }
}
