package dev.blanke.cobfuscator;

import java.util.Objects;

import dev.blanke.cobfuscator.ast.SourceUnit;

/**
 * @param unit  The final tree, or after a failure the tree produced by the last unit applied successfully.
 *
 * @param state Either {@link PipelineState.Done} or {@link PipelineState.Failed}.
 */
public record PipelineResult(SourceUnit unit, PipelineState state) {

    public PipelineResult {
        Objects.requireNonNull(unit);
        Objects.requireNonNull(state);
    }

    public boolean isSuccessful() {
        return state instanceof PipelineState.Done;
    }
}
