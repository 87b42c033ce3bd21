package dev.blanke.cobfuscator;

/**
 * The transformations a {@link ObfuscationUnit} can apply.
 *
 * @see UnitParameters#fromProperties(TransformKind, java.util.Map)
 */
public enum TransformKind {

    IDENTITY("Identity"),

    IDENTIFIER_RENAMING("Identifier Renaming"),

    INDEX_REVERSAL("Index Reversal"),

    ARITHMETIC_ENCODING("Arithmetic Encoding"),

    FUNCTION_INTERFACE_RANDOMISATION("Function Interface Randomisation"),

    OPAQUE_PREDICATE_AUGMENTATION("Opaque Predicate Augmentation"),

    OPAQUE_PREDICATE_INSERTION("Opaque Predicate Insertion"),

    CONTROL_FLOW_FLATTENING("Control Flow Flattening");

    private final String displayName;

    TransformKind(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
