package dev.blanke.cobfuscator;

import java.util.Map;
import java.util.Set;

import dev.blanke.cobfuscator.transform.Transform;
import dev.blanke.cobfuscator.transform.opaque.Granularity;
import dev.blanke.cobfuscator.transform.opaque.OpaqueInsertion;
import dev.blanke.cobfuscator.transform.opaque.PredicateKind;
import dev.blanke.cobfuscator.transform.opaque.PredicateStyle;

/**
 * @param number The number of predicates inserted into each function.
 */
public record OpaqueInsertionParameters(Set<PredicateStyle> styles,
                                        Set<Granularity>    granularities,
                                        Set<PredicateKind>  kinds,
                                        int                 number) implements UnitParameters {

    static final String STYLES = "styles";

    static final String GRANULARITIES = "granularities";

    static final String KINDS = "kinds";

    static final String NUMBER = "number";

    public OpaqueInsertionParameters {
        styles        = Set.copyOf(styles);
        granularities = Set.copyOf(granularities);
        kinds         = Set.copyOf(kinds);
    }

    @Override
    public TransformKind kind() {
        return TransformKind.OPAQUE_PREDICATE_INSERTION;
    }

    @Override
    public void validate() throws InvalidCompositionException {
        UnitProperties.requireNonEmpty(kind(), STYLES, styles);
        UnitProperties.requireNonEmpty(kind(), GRANULARITIES, granularities);
        UnitProperties.requireNonEmpty(kind(), KINDS, kinds);
        UnitProperties.requireNonNegative(kind(), NUMBER, number);
    }

    @Override
    public Transform createTransform() {
        return new OpaqueInsertion(styles, granularities, kinds, number);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(
            STYLES,        UnitProperties.format(styles),
            GRANULARITIES, UnitProperties.format(granularities),
            KINDS,         UnitProperties.format(kinds),
            NUMBER,        Integer.toString(number));
    }
}
