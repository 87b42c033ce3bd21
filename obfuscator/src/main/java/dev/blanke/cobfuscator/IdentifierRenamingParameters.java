package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.IdentifierRenaming;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * @param minimiseIdentifiers Whether to reuse names as often as possible instead of giving every binding its own.
 */
public record IdentifierRenamingParameters(boolean minimiseIdentifiers) implements UnitParameters {

    static final String MINIMISE_IDENTIFIERS = "minimise_idents";

    @Override
    public TransformKind kind() {
        return TransformKind.IDENTIFIER_RENAMING;
    }

    @Override
    public void validate() {
    }

    @Override
    public Transform createTransform() {
        return new IdentifierRenaming(minimiseIdentifiers);
    }

    @Override
    public Map<String, String> toProperties() {
        return Map.of(MINIMISE_IDENTIFIERS, Boolean.toString(minimiseIdentifiers));
    }
}
