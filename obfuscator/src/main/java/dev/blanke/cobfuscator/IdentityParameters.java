package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.IdentityTransform;
import dev.blanke.cobfuscator.transform.Transform;

public record IdentityParameters() implements UnitParameters {

    @Override
    public TransformKind kind() {
        return TransformKind.IDENTITY;
    }

    @Override
    public void validate() {
    }

    @Override
    public Transform createTransform() {
        return new IdentityTransform();
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of();
    }
}
