package dev.blanke.cobfuscator.transform.opaque;

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.blanke.cobfuscator.ast.CSourceWriter;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.WhileStatement;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.SemanticAssertions.assertSameBehavior;
import static dev.blanke.cobfuscator.util.TreeNodes.findAll;

final class OpaqueInsertionTest {

    @Language("C")
    private static final String PROGRAM = """
        int f(int x) {
            int total = 0;
            int i;
            for (i = 0; i < 6; i++) {
                if (i % 2 == 0)
                    total += i * x;
                else
                    total -= 1;
            }
            switch (x & 3) {
            case 0:
                total += 10;
                break;
            case 1:
                total *= 2;
            default:
                total--;
            }
            int result = total + x;
            printf("%d\\n", result);
            return result;
        }
        """;

    private static OpaqueInsertion insertion(final Set<PredicateStyle> styles, final Set<PredicateKind> kinds,
                                             final int number) {
        return new OpaqueInsertion(styles, EnumSet.allOf(Granularity.class), kinds, number);
    }

    @Nested
    final class Semantics {

        @ParameterizedTest
        @EnumSource(PredicateKind.class)
        void testBehaviorIsPreserved(final PredicateKind kind) {
            final var unit = parse(PROGRAM);
            final var transform = insertion(EnumSet.allOf(PredicateStyle.class), EnumSet.of(kind), 6);
            for (int seed = 0; seed < 5; seed++)
                assertSameBehavior(unit, transform.apply(unit, new Random(seed)), "f");
        }

        @Test
        void testMixedKindsPreserveBehavior() {
            final var unit = parse(PROGRAM);
            final var transform = insertion(EnumSet.allOf(PredicateStyle.class), EnumSet.allOf(PredicateKind.class),
                12);
            for (int seed = 0; seed < 10; seed++)
                assertSameBehavior(unit, transform.apply(unit, new Random(seed)), "f");
        }

        @Test
        void testEqualSeedsYieldEqualResults() {
            final var unit = parse(PROGRAM);
            final var transform = insertion(EnumSet.allOf(PredicateStyle.class), EnumSet.allOf(PredicateKind.class),
                8);
            assertEquals(CSourceWriter.write(transform.apply(unit, new Random(3))),
                CSourceWriter.write(transform.apply(unit, new Random(3))));
        }
    }

    @Nested
    final class Constructs {

        @Test
        void testEntropicVariablesAreDeclaredFirst() {
            final var unit = parse(PROGRAM);
            final var transform = new OpaqueInsertion(EnumSet.of(PredicateStyle.ENTROPIC),
                EnumSet.of(Granularity.PROCEDURAL), EnumSet.of(PredicateKind.CHECK), 1);
            final var function = (FunctionDefinition) transform.apply(unit, new Random(0)).declarations().get(0);

            final var items = function.body().items();
            final var entropy = assertInstanceOf(Declaration.class, items.get(0));
            assertTrue(entropy.name().startsWith("entropy"), entropy.name());
            assertInstanceOf(IfStatement.class, items.get(items.size() - 1));
        }

        @Test
        void testWhileFalseGuardsDeadCode() {
            final var unit = parse(PROGRAM);
            final var transformed = insertion(EnumSet.allOf(PredicateStyle.class),
                EnumSet.of(PredicateKind.WHILE_FALSE), 4).apply(unit, new Random(1));
            assertEquals(findAll(unit, WhileStatement.class).size() + 4,
                findAll(transformed, WhileStatement.class).size());
        }

        @Test
        void testNoVariablesMeansNoPredicates() {
            @Language("C")
            final var source = """
                int main(void) {
                    printf("hello\\n");
                    return 0;
                }
                """;
            final var unit = parse(source);
            final var transformed = insertion(EnumSet.of(PredicateStyle.DYNAMIC_INPUT),
                EnumSet.allOf(PredicateKind.class), 5).apply(unit, new Random(0));
            assertEquals(CSourceWriter.write(unit), CSourceWriter.write(transformed));
        }

        @Test
        void testZeroPredicatesLeaveTheTreeUnchanged() {
            final var unit = parse(PROGRAM);
            assertSame(unit, insertion(EnumSet.allOf(PredicateStyle.class), EnumSet.allOf(PredicateKind.class), 0)
                .apply(unit, new Random(0)));
        }
    }
}
