package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.function.IntUnaryOperator;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.Expression;

/**
 * Control leaves the function.
 *
 * @param implicit Whether control reaches the closing brace of the function rather than a {@code return} statement.
 */
public record Return(@Nullable Expression value, boolean implicit) implements Terminator {

    @Override
    public List<Integer> successors() {
        return List.of();
    }

    @Override
    public Return remap(final IntUnaryOperator ids) {
        return this;
    }
}
