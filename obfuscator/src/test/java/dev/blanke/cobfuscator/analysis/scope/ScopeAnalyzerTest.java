package dev.blanke.cobfuscator.analysis.scope;

import java.util.Set;
import java.util.stream.Collectors;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.ReturnStatement;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.TagDeclaration;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.TreeNodes.findAll;
import static dev.blanke.cobfuscator.util.TreeNodes.findFirst;
import static dev.blanke.cobfuscator.util.TreeNodes.identifiersNamed;

final class ScopeAnalyzerTest {

    @Language("C")
    private static final String SHADOWING = """
        int x = 1;

        int f(void) {
            int y = x;
            {
                int x = 2;
                y += x;
            }
            return x + y;
        }
        """;

    @Nested
    final class Resolution {

        @Test
        void testInnerDeclarationShadowsOuter() {
            final var unit  = parse(SHADOWING);
            final var model = ScopeAnalyzer.analyze(unit);
            final var uses  = identifiersNamed(unit, "x");
            assertEquals(3, uses.size());

            final var global = model.bindingOf(uses.get(0));
            assertNotNull(global);
            assertSame(model.getFileScope(), global.getScope());
            assertTrue(global.hasStaticStorage());

            final var local = model.bindingOf(uses.get(1));
            assertNotNull(local);
            assertNotSame(global, local);
            assertEquals(ScopeKind.BLOCK, local.getScope().getKind());
            assertTrue(local.isAutomatic());

            assertSame(global, model.bindingOf(uses.get(2)));
        }

        @Test
        void testDeclarationBecomesVisibleAfterItsDeclarator() {
            final var unit  = parse(SHADOWING);
            final var model = ScopeAnalyzer.analyze(unit);

            final var local = model.bindingOf(identifiersNamed(unit, "x").get(1));
            final var returnPoint = model.pointOf(findFirst(unit, ReturnStatement.class));
            assertFalse(model.isVisible(local, returnPoint));

            final var visible = model.visibleAt(returnPoint, NameSpace.ORDINARY).stream()
                .filter(binding -> binding.getName().equals("x"))
                .toList();
            assertEquals(1, visible.size());
            assertSame(model.getFileScope(), visible.get(0).getScope());
        }

        @Test
        void testBlockScopeExternRefersToFileScopeBinding() {
            @Language("C")
            final var source = """
                int g;

                int f(void) {
                    extern int g;
                    return g;
                }
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));
            assertEquals(1, model.bindingsNamed("g").size());
        }

        @Test
        void testUndeclaredNamesAreRecorded() {
            @Language("C")
            final var source = """
                int main(void) {
                    printf("%d", 1);
                    return 0;
                }
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));
            assertEquals(Set.of("printf"), model.getUnresolvedNames());
            assertTrue(model.getNames().contains("printf"));
        }

        @Test
        void testParametersAreInitialized() {
            @Language("C")
            final var source = """
                int f(int a) {
                    static int calls;
                    int b;
                    b = a + calls++;
                    return b;
                }
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));

            final var parameter = model.bindingsNamed("a").get(0);
            assertTrue(parameter.isAutomatic());
            assertTrue(parameter.isInitialized());
            assertEquals(ScopeKind.FUNCTION, parameter.getScope().getKind());

            final var calls = model.bindingsNamed("calls").get(0);
            assertTrue(calls.hasStaticStorage());
            assertTrue(calls.isInitialized());

            assertFalse(model.bindingsNamed("b").get(0).isInitialized());
        }

        @Test
        void testVariableIsUninitializedWithinItsInitializer() {
            @Language("C")
            final var source = """
                int f(int a) {
                    int b = a + 1;
                    return b;
                }
                """;
            final var unit  = parse(source);
            final var model = ScopeAnalyzer.analyze(unit);
            final var b = model.bindingsNamed("b").get(0);

            assertTrue(b.isInitialized());
            assertFalse(b.isInitializedAt(model.pointOf(identifiersNamed(unit, "a").get(0))));
            assertTrue(b.isInitializedAt(model.pointOf(findFirst(unit, ReturnStatement.class))));
            assertTrue(model.bindingsNamed("a").get(0).isInitializedAt(model.pointOf(identifiersNamed(unit, "a").get(0))));
        }
    }

    @Nested
    final class NameSpaces {

        @Test
        void testTagMemberAndOrdinaryNamesAreDisjoint() {
            @Language("C")
            final var source = """
                struct x { int x; } x;
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));
            final var nameSpaces = model.bindingsNamed("x").stream()
                .map(Binding::getNameSpace)
                .collect(Collectors.toSet());
            assertEquals(Set.of(NameSpace.TAG, NameSpace.MEMBER, NameSpace.ORDINARY), nameSpaces);
        }

        @Test
        void testMembersBelongToTheirAggregate() {
            @Language("C")
            final var source = """
                struct point { int x; int y; };
                """;
            final var unit  = parse(source);
            final var model = ScopeAnalyzer.analyze(unit);

            final var definition = (StructType) ((TagDeclaration) unit.declarations().get(0)).type();
            final var member = model.member(definition, "y");
            assertNotNull(member);
            assertEquals(BindingKind.MEMBER, member.getKind());
            assertEquals(ScopeKind.AGGREGATE, member.getScope().getKind());
            assertNull(model.member(definition, "z"));
        }

        @Test
        void testLabelsAreVisibleThroughoutTheirFunction() {
            @Language("C")
            final var source = """
                int f(int l) {
                    goto l;
                    l = 1;
                l:
                    return l;
                }
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));

            final var label = model.bindingsNamed("l").stream()
                .filter(binding -> binding.getNameSpace() == NameSpace.LABEL)
                .findFirst()
                .orElseThrow();
            assertEquals(BindingKind.LABEL, label.getKind());
            assertEquals(2, label.getOccurrences().size());

            final var parameter = model.bindingsNamed("l").stream()
                .filter(binding -> binding.getNameSpace() == NameSpace.ORDINARY)
                .findFirst()
                .orElseThrow();
            assertEquals(BindingKind.VARIABLE, parameter.getKind());
            assertFalse(model.conflicts(label, parameter));
        }
    }

    @Nested
    final class Freshness {

        @Test
        void testIsFree() {
            final var unit  = parse(SHADOWING);
            final var model = ScopeAnalyzer.analyze(unit);
            final var point = model.pointOf(findAll(unit, Declaration.class).get(1));

            assertTrue(model.isFree("z", NameSpace.ORDINARY, point));
            // A later use of the global would be captured.
            assertFalse(model.isFree("x", NameSpace.ORDINARY, point));
            assertFalse(model.isFree("while", NameSpace.ORDINARY, point));
            assertTrue(model.isFree("x", NameSpace.LABEL, point));
        }

        @Test
        void testConflicts() {
            @Language("C")
            final var source = """
                void h(int c) {
                    { int a = 1; a++; }
                    { int b = 2; b += c; }
                }
                """;
            final var model = ScopeAnalyzer.analyze(parse(source));
            final var a = model.bindingsNamed("a").get(0);
            final var b = model.bindingsNamed("b").get(0);
            final var c = model.bindingsNamed("c").get(0);

            assertFalse(model.conflicts(a, b));
            assertTrue(model.conflicts(b, c));
            assertFalse(a.getLivenessRange().overlaps(b.getLivenessRange()));
        }

        @Test
        void testNameAllocatorAvoidsUsedNames() {
            final var allocator = new NameAllocator(ScopeAnalyzer.analyze(parse(SHADOWING)));

            assertEquals("x1", allocator.allocate("x"));
            assertEquals("x2", allocator.allocate("x"));
            assertEquals("state", allocator.allocate("state"));
            assertEquals("state1", allocator.allocate("state"));
            assertEquals("int1", allocator.allocate("int"));
            assertTrue(allocator.isTaken("y"));

            allocator.reserve("end");
            assertEquals("end1", allocator.allocate("end"));
        }

        @Test
        void testNameGeneratorYieldsShortestNamesFirst() {
            final var generator = new NameGenerator();
            assertEquals("a", generator.next());
            for (int i = 1; i < 51; i++)
                generator.next();
            assertEquals("Z", generator.next());
            assertEquals("aa", generator.next());
            assertEquals("ab", generator.next());
        }
    }
}
