package dev.blanke.cobfuscator.transform.opaque;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.CSourceWriter;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;
import dev.blanke.cobfuscator.util.CInterpreter;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.CSourceParser.parseExpression;

final class OpaquePredicatesTest {

    private static final int SAMPLES = 10_000;

    private static final long[] EDGE_VALUES = { 0, 1, -1, 2, 3, Integer.MAX_VALUE, Integer.MIN_VALUE };

    private static SourceUnit predicateFunction(final Expression predicate) {
        return parse("int p(int x, int y) { return " + CSourceWriter.write(predicate) + "; }");
    }

    @ParameterizedTest
    @EnumSource(TruePredicate.class)
    void testTruePredicatesHoldForAllValues(final TruePredicate form) {
        final var alwaysTrue  = predicateFunction(OpaquePredicates.alwaysTrue(form, List.of("x", "y")));
        final var alwaysFalse = predicateFunction(OpaquePredicates.alwaysFalse(form, List.of("x", "y")));

        for (final var x : EDGE_VALUES)
            for (final var y : EDGE_VALUES) {
                assertEquals(1, CInterpreter.call(alwaysTrue, "p", x, y).returnValue(), form + " at " + x + ", " + y);
                assertEquals(0, CInterpreter.call(alwaysFalse, "p", x, y).returnValue(), form + " at " + x + ", " + y);
            }
        final var random = new Random(form.ordinal());
        for (int i = 0; i < SAMPLES; i++) {
            final long x = random.nextInt();
            final long y = random.nextInt();
            assertEquals(1, CInterpreter.call(alwaysTrue, "p", x, y).returnValue(), form + " at " + x + ", " + y);
        }
    }

    @Test
    void testTooFewVariablesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> OpaquePredicates.alwaysTrue(TruePredicate.SUM_OF_SQUARES, List.of("x")));
    }

    @Test
    void testOperandsAreReadAsUnsigned() {
        final var written = CSourceWriter.write(
            OpaquePredicates.alwaysTrue(TruePredicate.SQUARE_NOT_TWO_MOD_FOUR, List.of("v")));
        assertEquals("((unsigned int)v * (unsigned int)v & 3u) != 2u", written);
    }

    @Test
    void testNegateInvertsComparisons() {
        final var negated = assertInstanceOf(BinaryExpression.class, OpaquePredicates.negate(parseExpression("a < b")));
        assertEquals(BinaryOperator.GREATER_EQUAL, negated.operator());
    }

    @Test
    void testNegateAppliesDeMorgan() {
        assertEquals("a >= b || c != 0", CSourceWriter.write(OpaquePredicates.negate(parseExpression("a < b && c == 0"))));
        assertEquals("!x && y > 1", CSourceWriter.write(OpaquePredicates.negate(parseExpression("x || y <= 1"))));
    }

    @Test
    void testNegateRemovesLogicalNot() {
        final var x = Trees.identifier("x");
        assertSame(x, OpaquePredicates.negate(new UnaryExpression(UnaryOperator.LOGICAL_NOT, x)));
    }

    @Test
    void testEitherOnlyReadsThePassedVariables() {
        final var random = new Random(0);
        for (int i = 0; i < 50; i++) {
            final var written = CSourceWriter.write(OpaquePredicates.either(random, List.of("m", "n")));
            assertTrue(written.contains("m"), written);
            assertFalse(written.matches(".*\\b(?!m\\b|n\\b)[a-z_]\\w*.*"), written);
        }
    }
}
