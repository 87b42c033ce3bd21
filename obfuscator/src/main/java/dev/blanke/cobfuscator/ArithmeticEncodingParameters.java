package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.ArithmeticEncoding;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * @param depth How many times the operands of an encoded expression are encoded again.
 */
public record ArithmeticEncodingParameters(int depth) implements UnitParameters {

    static final String DEPTH = "depth";

    @Override
    public TransformKind kind() {
        return TransformKind.ARITHMETIC_ENCODING;
    }

    @Override
    public void validate() throws InvalidCompositionException {
        UnitProperties.requireNonNegative(kind(), DEPTH, depth);
    }

    @Override
    public Transform createTransform() {
        return new ArithmeticEncoding(depth);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(DEPTH, Integer.toString(depth));
    }
}
