package dev.blanke.cobfuscator;

import java.util.Map;
import java.util.Objects;

import dev.blanke.cobfuscator.transform.CaseStyle;
import dev.blanke.cobfuscator.transform.ControlFlowFlattening;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * @param randomiseCases Whether to shuffle the cases of the dispatching {@code switch} statement.
 *
 * @param style          How the cases are labelled.
 */
public record ControlFlowFlatteningParameters(boolean randomiseCases, CaseStyle style) implements UnitParameters {

    static final String RANDOMISE_CASES = "randomise_cases";

    static final String STYLE = "style";

    public ControlFlowFlatteningParameters {
        Objects.requireNonNull(style);
    }

    @Override
    public TransformKind kind() {
        return TransformKind.CONTROL_FLOW_FLATTENING;
    }

    @Override
    public void validate() {
    }

    @Override
    public Transform createTransform() {
        return new ControlFlowFlattening(randomiseCases, style);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(
            RANDOMISE_CASES, Boolean.toString(randomiseCases),
            STYLE,           style.name());
    }
}
