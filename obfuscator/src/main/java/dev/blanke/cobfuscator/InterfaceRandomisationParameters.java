package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.FunctionInterfaceRandomization;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * @param extraParameters     The number of unused parameters added to each function.
 *
 * @param variableProbability The probability of passing a variable instead of a literal for an added parameter.
 *
 * @param randomiseOrder      Whether to shuffle the parameters.
 */
public record InterfaceRandomisationParameters(int     extraParameters,
                                               double  variableProbability,
                                               boolean randomiseOrder) implements UnitParameters {

    static final String EXTRA_PARAMETERS = "extra_args";

    static final String VARIABLE_PROBABILITY = "probability";

    static final String RANDOMISE_ORDER = "randomise";

    @Override
    public TransformKind kind() {
        return TransformKind.FUNCTION_INTERFACE_RANDOMISATION;
    }

    @Override
    public void validate() throws InvalidCompositionException {
        UnitProperties.requireNonNegative(kind(), EXTRA_PARAMETERS, extraParameters);
        UnitProperties.requireProbability(kind(), VARIABLE_PROBABILITY, variableProbability);
    }

    @Override
    public Transform createTransform() {
        return new FunctionInterfaceRandomization(extraParameters, variableProbability, randomiseOrder);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(
            EXTRA_PARAMETERS,     Integer.toString(extraParameters),
            VARIABLE_PROBABILITY, Double.toString(variableProbability),
            RANDOMISE_ORDER,      Boolean.toString(randomiseOrder));
    }
}
