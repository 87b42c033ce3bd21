package dev.blanke.cobfuscator;

import java.util.Objects;

/**
 * The progress of a {@link Pipeline}: {@code Idle -> Running(0) -> ... -> Running(n - 1) -> Done}, or
 * {@code Failed(i, e)} once unit {@code i} refuses the tree it was given or throws.
 */
public interface PipelineState {

    record Idle() implements PipelineState {
    }

    /**
     * @param index The index of the unit being applied.
     */
    record Running(int index) implements PipelineState {
    }

    record Done() implements PipelineState {
    }

    /**
     * @param index The index of the unit which failed.
     *
     * @param error Usually a {@link dev.blanke.cobfuscator.transform.PreconditionViolationException} or a
     *              {@link MalformedTreeException}.
     */
    record Failed(int index, RuntimeException error) implements PipelineState {

        public Failed {
            Objects.requireNonNull(error);
        }
    }
}
