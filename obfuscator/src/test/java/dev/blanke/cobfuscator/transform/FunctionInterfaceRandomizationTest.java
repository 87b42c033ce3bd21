package dev.blanke.cobfuscator.transform;

import java.util.Random;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dev.blanke.cobfuscator.ast.CSourceWriter;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.SourceUnit;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.SemanticAssertions.assertSameBehavior;

final class FunctionInterfaceRandomizationTest {

    @Language("C")
    private static final String PROGRAM = """
        int add(int a, int b);

        int twice(int x) {
            return add(x, x);
        }

        int add(int a, int b) {
            return a - 2 * b;
        }

        int main(void) {
            int seed = 5;
            printf("%d\\n", twice(seed) + add(1, 2));
            return add(seed, 3);
        }
        """;

    private static FunctionDefinition definition(final SourceUnit unit, final String name) {
        return unit.declarations().stream()
            .filter(FunctionDefinition.class::isInstance)
            .map(FunctionDefinition.class::cast)
            .filter(function -> function.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    final class Rewriting {

        @Test
        void testParametersAreAdded() {
            final var unit = parse(PROGRAM);
            final var randomized = new FunctionInterfaceRandomization(3, 0.5, true).apply(unit, new Random(0));

            assertEquals(5, definition(randomized, "add").type().parameters().size());
            assertEquals(4, definition(randomized, "twice").type().parameters().size());
            assertEquals(0, definition(randomized, "main").type().parameters().size());

            final var prototype = (Declaration) randomized.declarations().get(0);
            assertEquals(5, ((FunctionType) prototype.type()).parameters().size());
        }

        @Test
        void testBehaviorIsPreserved() {
            final var unit = parse(PROGRAM);
            for (int seed = 0; seed < 8; seed++) {
                assertSameBehavior(unit,
                    new FunctionInterfaceRandomization(2, 0.5, true).apply(unit, new Random(seed)));
                assertSameBehavior(unit,
                    new FunctionInterfaceRandomization(0, 0.0, true).apply(unit, new Random(seed)));
            }
        }

        @Test
        void testVariadicFunctionsAreKept() {
            @Language("C")
            final var source = """
                int first(int n, ...) {
                    return n;
                }

                int main(void) {
                    return first(1, 2, 3);
                }
                """;
            final var unit = parse(source);
            assertEquals(CSourceWriter.write(unit),
                CSourceWriter.write(new FunctionInterfaceRandomization(2, 1.0, true).apply(unit, new Random(0))));
        }

        @Test
        void testEqualSeedsYieldEqualInterfaces() {
            final var unit = parse(PROGRAM);
            final var transform = new FunctionInterfaceRandomization(2, 0.5, true);
            assertEquals(CSourceWriter.write(transform.apply(unit, new Random(9))),
                CSourceWriter.write(transform.apply(unit, new Random(9))));
        }
    }

    @Nested
    final class Preconditions {

        @Test
        void testEscapingFunctionPointer() {
            @Language("C")
            final var source = """
                int identity(int x) {
                    return x;
                }

                int (*pointer)(int) = identity;
                """;
            final var exception = assertThrows(PreconditionViolationException.class,
                () -> new FunctionInterfaceRandomization(1, 0.0, false).apply(parse(source), new Random(0)));
            assertEquals("Address of function 'identity' escapes", exception.getMessage());
        }

        @Test
        void testArgumentCountMismatch() {
            @Language("C")
            final var source = """
                int identity(int x) {
                    return x;
                }

                int main(void) {
                    return identity(1, 2);
                }
                """;
            assertThrows(PreconditionViolationException.class,
                () -> new FunctionInterfaceRandomization(1, 0.0, false).apply(parse(source), new Random(0)));
        }
    }
}
