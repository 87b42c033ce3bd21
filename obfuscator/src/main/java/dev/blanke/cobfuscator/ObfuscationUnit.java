package dev.blanke.cobfuscator;

import java.util.Objects;

import dev.blanke.cobfuscator.transform.Transform;

/**
 * One step of a {@link Composition}: the parameters of a transform and whether it takes part in a run.
 */
public final class ObfuscationUnit {

    private final UnitParameters parameters;

    private boolean enabled = true;

    public ObfuscationUnit(final UnitParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public UnitParameters getParameters() {
        return parameters;
    }

    public TransformKind getKind() {
        return parameters.kind();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    Transform createTransform() {
        return parameters.createTransform();
    }

    @Override
    public String toString() {
        return getKind().getDisplayName() + (enabled ? "" : " (disabled)");
    }
}
