package dev.blanke.cobfuscator;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Objects;
import java.util.Random;

import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.transform.PreconditionViolationException;

/**
 * Applies the units of a {@link Composition} in order to a translation unit.
 * <p>
 * A run is a deterministic function of the input tree, the composition and the seed: every run draws from a fresh
 * {@link Random} seeded with {@link #getSeed()}, which is passed to each enabled unit in turn. Each unit analyzes the
 * tree it receives itself; nothing is cached between units.
 * <p>
 * The passed tree is never modified. If a unit refuses the tree, or produces one which is no longer well-formed, the
 * run stops and the tree produced by the units before it is returned alongside a {@link PipelineState.Failed} state.
 * Any other exception thrown by a unit also leaves the pipeline {@code Failed} before it propagates.
 */
public final class Pipeline {

    private static final Logger LOGGER = System.getLogger(Pipeline.class.getName());

    private final Composition composition;

    private final long seed;

    private PipelineState state = new PipelineState.Idle();

    public Pipeline(final Composition composition, final long seed) {
        this.composition = Objects.requireNonNull(composition);
        this.seed        = seed;
    }

    /**
     * @throws InvalidCompositionException If a unit has invalid parameters. The state remains {@code Idle}.
     *
     * @throws MalformedTreeException      If the passed tree is not a valid translation unit. The state remains
     *                                     {@code Idle}.
     */
    public PipelineResult run(final SourceUnit unit) throws InvalidCompositionException {
        composition.validate();
        SourceUnitValidator.validate(unit);

        final var random = new Random(seed);
        final var units  = composition.getUnits();

        var current = unit;
        for (int index = 0; index < units.size(); ++index) {
            final var obfuscationUnit = units.get(index);
            state = new PipelineState.Running(index);

            if (!obfuscationUnit.isEnabled()) {
                LOGGER.log(Level.DEBUG, "Skipping disabled unit {0} ({1})", index, obfuscationUnit);
                continue;
            }
            LOGGER.log(Level.INFO, "Applying unit {0} ({1})...", index, obfuscationUnit);
            try {
                current = obfuscationUnit.createTransform().apply(current, random);
            } catch (final PreconditionViolationException | MalformedTreeException exception) {
                LOGGER.log(Level.WARNING, "Unit {0} ({1}) failed: {2}", index, obfuscationUnit,
                    exception.getMessage());
                state = new PipelineState.Failed(index, exception);
                return new PipelineResult(current, state);
            } catch (final RuntimeException exception) {
                LOGGER.log(Level.ERROR, "Unit " + index + " (" + obfuscationUnit + ") threw", exception);
                state = new PipelineState.Failed(index, exception);
                throw exception;
            }
        }
        state = new PipelineState.Done();
        return new PipelineResult(current, state);
    }

    public PipelineState state() {
        return state;
    }

    public Composition getComposition() {
        return composition;
    }

    public long getSeed() {
        return seed;
    }
}
