package dev.blanke.cobfuscator;

import java.util.Map;

import dev.blanke.cobfuscator.transform.CaseStyle;
import dev.blanke.cobfuscator.transform.Transform;
import dev.blanke.cobfuscator.transform.opaque.Granularity;
import dev.blanke.cobfuscator.transform.opaque.PredicateKind;
import dev.blanke.cobfuscator.transform.opaque.PredicateStyle;

/**
 * The immutable parameters of an {@link ObfuscationUnit}, one record per {@link TransformKind}.
 * <p>
 * Parameters convert to and from string properties under fixed keys, independent of how a composition is persisted.
 */
public interface UnitParameters {

    TransformKind kind();

    /**
     * Checks that all values lie in their valid ranges.
     */
    void validate() throws InvalidCompositionException;

    /**
     * Creates the transform configured by these parameters.
     */
    Transform createTransform();

    /**
     * @return The properties from which {@link #fromProperties(TransformKind, Map)} recreates equal parameters.
     */
    Map<String, String> toProperties();

    /**
     * Reads the parameters of a unit of the passed kind. The values are not validated.
     *
     * @throws InvalidCompositionException If a property is missing, malformed, or unknown to the kind.
     */
    static UnitParameters fromProperties(final TransformKind       kind,
                                         final Map<String, String> properties) throws InvalidCompositionException {
        final var reader = new UnitProperties(kind, properties);
        final UnitParameters parameters = switch (kind) {
            case IDENTITY -> new IdentityParameters();
            case IDENTIFIER_RENAMING -> new IdentifierRenamingParameters(
                reader.bool(IdentifierRenamingParameters.MINIMISE_IDENTIFIERS));
            case INDEX_REVERSAL -> new IndexReversalParameters(
                reader.decimal(IndexReversalParameters.PROBABILITY));
            case ARITHMETIC_ENCODING -> new ArithmeticEncodingParameters(
                reader.integer(ArithmeticEncodingParameters.DEPTH));
            case FUNCTION_INTERFACE_RANDOMISATION -> new InterfaceRandomisationParameters(
                reader.integer(InterfaceRandomisationParameters.EXTRA_PARAMETERS),
                reader.decimal(InterfaceRandomisationParameters.VARIABLE_PROBABILITY),
                reader.bool(InterfaceRandomisationParameters.RANDOMISE_ORDER));
            case OPAQUE_PREDICATE_AUGMENTATION -> new OpaqueAugmentationParameters(
                reader.constants(OpaqueAugmentationParameters.STYLES, PredicateStyle.class),
                reader.decimal(OpaqueAugmentationParameters.PROBABILITY),
                reader.integer(OpaqueAugmentationParameters.NUMBER));
            case OPAQUE_PREDICATE_INSERTION -> new OpaqueInsertionParameters(
                reader.constants(OpaqueInsertionParameters.STYLES, PredicateStyle.class),
                reader.constants(OpaqueInsertionParameters.GRANULARITIES, Granularity.class),
                reader.constants(OpaqueInsertionParameters.KINDS, PredicateKind.class),
                reader.integer(OpaqueInsertionParameters.NUMBER));
            case CONTROL_FLOW_FLATTENING -> new ControlFlowFlatteningParameters(
                reader.bool(ControlFlowFlatteningParameters.RANDOMISE_CASES),
                reader.constant(ControlFlowFlatteningParameters.STYLE, CaseStyle.class));
        };
        reader.requireAllRead();
        return parameters;
    }
}
