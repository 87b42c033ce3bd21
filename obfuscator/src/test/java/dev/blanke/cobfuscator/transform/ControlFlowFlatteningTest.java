package dev.blanke.cobfuscator.transform;

import java.util.List;
import java.util.Random;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.blanke.cobfuscator.ast.ArrayType;
import dev.blanke.cobfuscator.ast.CSourceWriter;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.SwitchStatement;
import dev.blanke.cobfuscator.ast.TagDeclaration;
import dev.blanke.cobfuscator.ast.TypedefDeclaration;
import dev.blanke.cobfuscator.util.CInterpreter;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.SemanticAssertions.assertSameBehavior;
import static dev.blanke.cobfuscator.util.SemanticAssertions.reparse;
import static dev.blanke.cobfuscator.util.TreeNodes.findAll;

final class ControlFlowFlatteningTest {

    @Language("C")
    private static final String BRANCHES = """
        int f(int x) {
            if (x > 0)
                return 1;
            else
                return 2;
        }
        """;

    @Language("C")
    private static final String PROGRAM = """
        struct pair { int first; int second; };

        int f(int x) {
            int total = x;
            {
                int total = 3;
                x += total;
            }
            struct pair p = { x, 2 };
            int values[3] = { 1, 2 };
            for (int i = 0; i < 5; i++) {
                if (i == 2)
                    continue;
                total += i * values[i % 3];
            }
            switch (x & 3) {
            case 0:
                total++;
            case 1:
                total += p.second;
                break;
            default:
                total -= p.first;
            }
            int n = (x & 1) + 2;
            int vla[n];
            for (int j = 0; j < n; j++)
                vla[j] = j * total;
            while (1) {
                if (total > 50)
                    goto done;
                total += vla[n - 1] + 7;
            }
        done:
            printf("%d\\n", total);
            return total;
        }
        """;

    private static FunctionDefinition function(final String name, final SourceUnit unit) {
        return unit.declarations().stream()
            .filter(FunctionDefinition.class::isInstance)
            .map(FunctionDefinition.class::cast)
            .filter(definition -> definition.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    final class Dispatch {

        @Test
        void testSequentialStatesFollowTheOriginalControlFlow() {
            final var unit = parse(BRANCHES);
            final var flattened = reparse(new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL)
                .apply(unit, new Random(1)));

            assertEquals(List.of(0L, 1L), CInterpreter.call(flattened, "f", 5).dispatches());
            assertEquals(List.of(0L, 2L), CInterpreter.call(flattened, "f", -1).dispatches());
            assertEquals(1, CInterpreter.call(flattened, "f", 5).returnValue());
            assertEquals(2, CInterpreter.call(flattened, "f", -1).returnValue());
        }

        @Test
        void testSequentialCaseValuesFollowSourceOrder() {
            final var unit = parse(BRANCHES);
            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(1));

            final var values = findAll(flattened, CaseStatement.class).stream()
                .map(caseStatement -> ((IntegerConstant) caseStatement.value()).value())
                .toList();
            assertEquals(List.of(0L, 1L, 2L), values);
            assertSameBehavior(unit, flattened, "f");
        }

        @Test
        void testStateVariableIsDeclaredFirst() {
            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL)
                .apply(parse(BRANCHES), new Random(1));

            final var first = function("f", flattened).body().items().get(0);
            final var state = assertInstanceOf(Declaration.class, first);
            assertEquals("state", state.name());
            assertEquals(1, findAll(flattened, SwitchStatement.class).size());
        }

        @Test
        void testStateVariableAvoidsExistingNames() {
            @Language("C")
            final var source = """
                int f(int state) {
                    if (state)
                        state--;
                    return state;
                }
                """;
            final var unit = parse(source);
            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(3));

            final var first = assertInstanceOf(Declaration.class, function("f", flattened).body().items().get(0));
            assertNotEquals("state", first.name());
            assertSameBehavior(unit, flattened, "f");
        }

        @Test
        void testEnumeratorStyleDeclaresAnonymousEnumeration() {
            final var unit = parse(BRANCHES);
            final var flattened = new ControlFlowFlattening(true, CaseStyle.ENUMERATOR).apply(unit, new Random(5));

            assertInstanceOf(TagDeclaration.class, function("f", flattened).body().items().get(0));
            assertSameBehavior(unit, flattened, "f");
        }

        @Test
        void testFallingOffNonVoidFunctionJumpsToEnd() {
            @Language("C")
            final var source = """
                int f(int x) {
                    if (x)
                        return 1;
                }
                """;
            final var written = CSourceWriter.write(
                new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(parse(source), new Random(1)));
            assertTrue(written.contains("goto end;"), written);
            assertTrue(written.contains("end:"), written);
        }

        @Test
        void testMainReturnsZeroWhenFallingOff() {
            @Language("C")
            final var source = """
                int main(void) {
                    int a = 4;
                    if (a > 2)
                        printf("big\\n");
                }
                """;
            final var unit = parse(source);
            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(1));
            assertFalse(CSourceWriter.write(flattened).contains("goto end;"));
            assertSameBehavior(unit, flattened);
        }
    }

    @Nested
    final class Semantics {

        @ParameterizedTest
        @EnumSource(CaseStyle.class)
        void testBehaviorIsPreserved(final CaseStyle style) {
            final var unit = parse(PROGRAM);
            for (int seed = 0; seed < 4; seed++) {
                assertSameBehavior(unit, new ControlFlowFlattening(false, style).apply(unit, new Random(seed)), "f");
                assertSameBehavior(unit, new ControlFlowFlattening(true, style).apply(unit, new Random(seed)), "f");
            }
        }

        @Test
        void testArraysInitializedByStringLiterals() {
            @Language("C")
            final var source = """
                int f(int x) {
                    char s[] = "abc";
                    char padded[6] = "hi\\n";
                    const char quote[] = "it's";
                    if (x > 0)
                        return s[1] + padded[4] + quote[2];
                    return s[0] + padded[2] + padded[5] + (int) sizeof(s) + (int) sizeof(padded);
                }
                """;
            final var unit = parse(source);
            for (int seed = 0; seed < 3; seed++)
                assertSameBehavior(unit, new ControlFlowFlattening(true, CaseStyle.RANDOM_INT)
                    .apply(unit, new Random(seed)), "f");

            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(0));
            final var hoisted = findAll(flattened, Declaration.class).stream()
                .filter(declaration -> declaration.name().equals("s"))
                .findFirst()
                .orElseThrow();
            final var array = assertInstanceOf(ArrayType.class, hoisted.type());
            assertEquals(4, ((IntegerConstant) array.size()).value());
            assertNull(hoisted.initializer());
        }

        @Test
        void testAggregatesNamedByTypedef() {
            @Language("C")
            final var source = """
                typedef struct { int a; int b; } P;

                int f(int x) {
                    P p = { x, 2 };
                    P pairs[2] = { { 1, x }, { 3, 4 } };
                    if (x > 0)
                        return p.a * p.b + pairs[0].b;
                    return p.b + pairs[1].a;
                }
                """;
            final var unit = parse(source);
            for (int seed = 0; seed < 3; seed++)
                assertSameBehavior(unit, new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL)
                    .apply(unit, new Random(seed)), "f");
        }

        @Test
        void testConstVariableIsAssignedItsInitialValue() {
            @Language("C")
            final var source = """
                int f(int x) {
                    const int k = x + 1;
                    if (k > 1)
                        return k;
                    return -k;
                }
                """;
            final var unit = parse(source);
            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(0));
            assertSameBehavior(unit, flattened, "f");

            final var hoisted = findAll(flattened, Declaration.class).stream()
                .filter(declaration -> declaration.name().equals("k"))
                .findFirst()
                .orElseThrow();
            assertInstanceOf(PrimitiveType.class, hoisted.type());
        }

        @Test
        void testShadowedLocalTypesAreRenamed() {
            @Language("C")
            final var source = """
                int f(int x) {
                    int r = 0;
                    {
                        typedef int T;
                        enum { A = 1 };
                        struct s { int v; } o = { x };
                        T t = A;
                        r += o.v + t;
                    }
                    {
                        typedef long T;
                        enum { A = 2 };
                        struct s { int w; int v; } o = { 1, x * 2 };
                        T t = A;
                        if (x > 0)
                            r += o.v * t + o.w;
                    }
                    return r;
                }
                """;
            final var unit = parse(source);
            for (final var style : CaseStyle.values())
                assertSameBehavior(unit, new ControlFlowFlattening(true, style).apply(unit, new Random(2)), "f");

            final var flattened = new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(unit, new Random(2));
            final var typedefs = findAll(flattened, TypedefDeclaration.class).stream()
                .map(TypedefDeclaration::name)
                .distinct()
                .count();
            assertEquals(2, typedefs);
        }

        @Test
        void testOriginalTreeIsLeftUntouched() {
            final var unit = parse(PROGRAM);
            final var before = CSourceWriter.write(unit);
            new ControlFlowFlattening(true, CaseStyle.RANDOM_INT).apply(unit, new Random(7));
            assertEquals(before, CSourceWriter.write(unit));
        }

        @Test
        void testEqualSeedsYieldEqualResults() {
            final var unit = parse(PROGRAM);
            final var transform = new ControlFlowFlattening(true, CaseStyle.RANDOM_INT);
            assertEquals(CSourceWriter.write(transform.apply(unit, new Random(11))),
                CSourceWriter.write(transform.apply(unit, new Random(11))));
        }
    }

    @Nested
    final class Preconditions {

        private static void assertViolation(@Language("C") final String source) {
            assertThrows(PreconditionViolationException.class,
                () -> new ControlFlowFlattening(false, CaseStyle.SEQUENTIAL).apply(parse(source), new Random(0)));
        }

        @Test
        void testConstArrayWithInitializerList() {
            assertViolation("int f(int x) { const int a[2] = { 1, 2 }; return a[x & 1]; }");
        }

        @Test
        void testMultiDimensionalVariableLengthArray() {
            assertViolation("int f(int n) { int m[n][n]; m[0][0] = 1; return m[0][0]; }");
        }

        @Test
        void testSizeOfVariableLengthArray() {
            assertViolation("int f(int n) { int v[n]; return (int) sizeof(v); }");
        }

        @Test
        void testDesignatedArrayInitializer() {
            assertViolation("int f(int x) { int a[3] = { [2] = 1 }; return a[x & 1]; }");
        }

        @Test
        void testAnonymousAggregate() {
            assertViolation("int f(int x) { struct { int a; } s = { x }; return s.a; }");
        }
    }
}
