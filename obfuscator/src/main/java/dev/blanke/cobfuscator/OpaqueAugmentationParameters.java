package dev.blanke.cobfuscator;

import java.util.Map;
import java.util.Set;

import dev.blanke.cobfuscator.transform.Transform;
import dev.blanke.cobfuscator.transform.opaque.OpaqueAugmentation;
import dev.blanke.cobfuscator.transform.opaque.PredicateStyle;

/**
 * @param styles      The sources of the variables predicates are built from.
 *
 * @param probability The probability of augmenting a condition.
 *
 * @param number      The number of predicates combined with an augmented condition.
 */
public record OpaqueAugmentationParameters(Set<PredicateStyle> styles,
                                           double              probability,
                                           int                 number) implements UnitParameters {

    static final String STYLES = "styles";

    static final String PROBABILITY = "probability";

    static final String NUMBER = "number";

    public OpaqueAugmentationParameters {
        styles = Set.copyOf(styles);
    }

    @Override
    public TransformKind kind() {
        return TransformKind.OPAQUE_PREDICATE_AUGMENTATION;
    }

    @Override
    public void validate() throws InvalidCompositionException {
        UnitProperties.requireNonEmpty(kind(), STYLES, styles);
        UnitProperties.requireProbability(kind(), PROBABILITY, probability);
        UnitProperties.requireNonNegative(kind(), NUMBER, number);
    }

    @Override
    public Transform createTransform() {
        return new OpaqueAugmentation(styles, probability, number);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(
            STYLES,      UnitProperties.format(styles),
            PROBABILITY, Double.toString(probability),
            NUMBER,      Integer.toString(number));
    }
}
