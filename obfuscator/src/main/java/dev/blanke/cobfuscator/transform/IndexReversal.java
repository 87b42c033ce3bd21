package dev.blanke.cobfuscator.transform;

import java.util.Random;

import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.SubscriptExpression;

/**
 * Swaps the operands of array subscripts, rewriting {@code a[i]} to the equivalent {@code i[a]}.
 */
public final class IndexReversal implements Transform {

    private final double probability;

    /**
     * @param probability The chance of each eligible subscript to be rewritten.
     */
    public IndexReversal(final double probability) {
        this.probability = probability;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return new IndexReversingTransformer(unit, random).transform();
    }

    private final class IndexReversingTransformer extends ObfuscatingTransformer {

        IndexReversingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
        }

        @Override
        public Expression transformSubscriptExpression(final SubscriptExpression expression) {
            final var transformed = super.transformSubscriptExpression(expression);
            final var array = infoOf(expression.array());
            final var index = infoOf(expression.index());
            if (array == null || index == null || array.type() == null || index.type() == null
                    || !array.effect().isSideEffectFree() || !index.effect().isSideEffectFree())
                return transformed;
            if (random.nextDouble() >= probability)
                return transformed;

            final var subscript = (SubscriptExpression) transformed;
            return new SubscriptExpression(subscript.index(), subscript.array());
        }
    }
}
