package dev.blanke.cobfuscator.transform;

import java.util.Random;

import dev.blanke.cobfuscator.ast.SourceUnit;

/**
 * A semantics-preserving rewrite of a translation unit.
 * <p>
 * Implementations analyze the passed tree themselves and never modify it; the result is a new tree sharing unchanged
 * subtrees with the passed one. All random decisions are drawn from the passed source, so that applying a transform
 * twice with equally seeded sources yields identical trees.
 */
@FunctionalInterface
public interface Transform {

    /**
     * @throws PreconditionViolationException If the unit contains a construct the transform cannot handle.
     */
    SourceUnit apply(SourceUnit unit, Random random);
}
