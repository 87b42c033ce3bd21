package dev.blanke.cobfuscator.transform;

import java.util.Random;

import dev.blanke.cobfuscator.ast.SourceUnit;

/**
 * Returns the translation unit unchanged. Serves as a placeholder unit in compositions.
 */
public final class IdentityTransform implements Transform {

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return unit;
    }
}
