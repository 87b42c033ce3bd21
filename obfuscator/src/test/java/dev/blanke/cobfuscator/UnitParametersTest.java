package dev.blanke.cobfuscator;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import dev.blanke.cobfuscator.transform.CaseStyle;
import dev.blanke.cobfuscator.transform.ControlFlowFlattening;
import dev.blanke.cobfuscator.transform.opaque.Granularity;
import dev.blanke.cobfuscator.transform.opaque.PredicateKind;
import dev.blanke.cobfuscator.transform.opaque.PredicateStyle;

import static org.junit.jupiter.api.Assertions.*;

final class UnitParametersTest {

    private static final Set<UnitParameters> EXAMPLES = Set.of(
        new IdentityParameters(),
        new IdentifierRenamingParameters(true),
        new IndexReversalParameters(0.25),
        new ArithmeticEncodingParameters(3),
        new InterfaceRandomisationParameters(2, 0.75, false),
        new OpaqueAugmentationParameters(EnumSet.of(PredicateStyle.ENTROPIC), 0.5, 2),
        new OpaqueInsertionParameters(EnumSet.allOf(PredicateStyle.class),
            EnumSet.of(Granularity.BLOCK, Granularity.STATEMENT), EnumSet.of(PredicateKind.EITHER), 4),
        new ControlFlowFlatteningParameters(true, CaseStyle.ENUMERATOR));

    @Test
    void testPropertiesRoundTrip() throws InvalidCompositionException {
        for (final var parameters : EXAMPLES) {
            parameters.validate();
            assertEquals(parameters, UnitParameters.fromProperties(parameters.kind(), parameters.toProperties()));
        }
    }

    @Test
    void testEverySetOfPropertiesCreatesItsTransform() {
        for (final var parameters : EXAMPLES)
            assertNotNull(parameters.createTransform(), parameters::toString);
        assertInstanceOf(ControlFlowFlattening.class,
            new ControlFlowFlatteningParameters(false, CaseStyle.SEQUENTIAL).createTransform());
    }

    @Test
    void testSetsAreWrittenInDeclarationOrder() {
        final var parameters = new OpaqueInsertionParameters(EnumSet.of(PredicateStyle.ENTROPIC),
            EnumSet.of(Granularity.STATEMENT, Granularity.PROCEDURAL), EnumSet.of(PredicateKind.CHECK), 1);
        assertEquals("PROCEDURAL,STATEMENT", parameters.toProperties().get("granularities"));
    }

    @Test
    void testMalformedValueIsRejected() {
        final var exception = assertThrows(InvalidCompositionException.class,
            () -> UnitParameters.fromProperties(TransformKind.INDEX_REVERSAL, Map.of("probability", "often")));
        assertTrue(exception.getMessage().contains("'often'"), exception.getMessage());

        assertThrows(InvalidCompositionException.class,
            () -> UnitParameters.fromProperties(TransformKind.IDENTIFIER_RENAMING, Map.of("minimise_idents", "yes")));
        assertThrows(InvalidCompositionException.class, () -> UnitParameters.fromProperties(
            TransformKind.CONTROL_FLOW_FLATTENING, Map.of("randomise_cases", "true", "style", "SHUFFLED")));
    }

    @Test
    void testMissingValueIsRejected() {
        final var exception = assertThrows(InvalidCompositionException.class,
            () -> UnitParameters.fromProperties(TransformKind.ARITHMETIC_ENCODING, Map.of()));
        assertTrue(exception.getMessage().contains("'depth'"), exception.getMessage());
    }

    @Test
    void testUnknownKeyIsRejected() {
        final var exception = assertThrows(InvalidCompositionException.class,
            () -> UnitParameters.fromProperties(TransformKind.ARITHMETIC_ENCODING,
                Map.of("depth", "1", "width", "2")));
        assertTrue(exception.getMessage().contains("width"), exception.getMessage());
    }

    @Test
    void testOutOfRangeValuesFailValidation() {
        assertThrows(InvalidCompositionException.class, () -> new IndexReversalParameters(-0.1).validate());
        assertThrows(InvalidCompositionException.class, () -> new ArithmeticEncodingParameters(-1).validate());
        assertThrows(InvalidCompositionException.class,
            () -> new InterfaceRandomisationParameters(1, 2.0, true).validate());
        assertThrows(InvalidCompositionException.class, () -> new OpaqueInsertionParameters(
            EnumSet.allOf(PredicateStyle.class), Set.of(), EnumSet.allOf(PredicateKind.class), 1).validate());
    }

    @Test
    void testEmptySetIsReadAsEmpty() throws InvalidCompositionException {
        final var parameters = (OpaqueAugmentationParameters) UnitParameters.fromProperties(
            TransformKind.OPAQUE_PREDICATE_AUGMENTATION, Map.of("styles", "", "probability", "0.5", "number", "1"));
        assertTrue(parameters.styles().isEmpty());
        assertThrows(InvalidCompositionException.class, parameters::validate);
    }
}
