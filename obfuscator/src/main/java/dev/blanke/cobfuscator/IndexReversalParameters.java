package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.IndexReversal;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * @param probability The probability of reversing an eligible subscript expression.
 */
public record IndexReversalParameters(double probability) implements UnitParameters {

    static final String PROBABILITY = "probability";

    @Override
    public TransformKind kind() {
        return TransformKind.INDEX_REVERSAL;
    }

    @Override
    public void validate() throws InvalidCompositionException {
        UnitProperties.requireProbability(kind(), PROBABILITY, probability);
    }

    @Override
    public Transform createTransform() {
        return new IndexReversal(probability);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(PROBABILITY, Double.toString(probability));
    }
}
