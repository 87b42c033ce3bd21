package dev.blanke.cobfuscator.ast;

import org.intellij.lang.annotations.Language;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import static dev.blanke.cobfuscator.util.CSourceParser.parse;
import static dev.blanke.cobfuscator.util.CSourceParser.parseExpression;

final class CSourceWriterTest {

    private static String rewrite(final String expression) {
        return CSourceWriter.write(parseExpression(expression));
    }

    @Nested
    final class Expressions {

        @Test
        void testRedundantParenthesesAreDropped() {
            assertEquals("a + b * c", rewrite("(a + (b * c))"));
            assertEquals("a - b - c", rewrite("(a - b) - c"));
            assertEquals("*p++", rewrite("*(p++)"));
        }

        @Test
        void testRequiredParenthesesAreKept() {
            assertEquals("(a + b) * c", rewrite("(a + b) * c"));
            assertEquals("a - (b - c)", rewrite("a - (b - c)"));
            assertEquals("(*p)++", rewrite("(*p)++"));
            assertEquals("(a & b) == 0", rewrite("(a & b) == 0"));
            assertEquals("f((a, b), c)", rewrite("f((a, b), c)"));
        }

        @Test
        void testRightAssociativeOperators() {
            assertEquals("a = b = c", rewrite("a = (b = c)"));
            assertEquals("x ? y : z ? u : v", rewrite("x ? y : (z ? u : v)"));
            assertEquals("(x ? y : z) ? u : v", rewrite("(x ? y : z) ? u : v"));
        }

        @Test
        void testAdjacentUnaryOperatorsDoNotMerge() {
            assertEquals("- -x", rewrite("-(-x)"));
            assertEquals("-x", rewrite("-x"));
            assertEquals("~-x", rewrite("~(-x)"));
        }

        @Test
        void testCastAndSizeof() {
            assertEquals("(int)(x + 1)", rewrite("(int) (x + 1)"));
            assertEquals("(unsigned int)x", rewrite("(unsigned) x"));
            assertEquals("sizeof(x)", rewrite("sizeof x"));
            assertEquals("sizeof(int)", rewrite("sizeof(int)"));
        }

        @Test
        void testMinimumIntegerConstant() {
            assertEquals("-2147483647 - 1", CSourceWriter.write(Trees.integer(Integer.MIN_VALUE)));
            assertEquals("-5", CSourceWriter.write(Trees.integer(-5)));
            assertEquals("4294967295u", CSourceWriter.write(Trees.unsigned(-1)));
        }
    }

    @Nested
    final class Declarations {

        @Test
        void testPointerToArray() {
            assertEquals("int (*p)[4];\n", CSourceWriter.write(parse("int (*p)[4];")));
        }

        @Test
        void testArrayOfPointers() {
            assertEquals("int *a[3];\n", CSourceWriter.write(parse("int *a[3];")));
        }

        @Test
        void testFunctionPointer() {
            assertEquals("int (*f)(int, char);\n", CSourceWriter.write(parse("int (*f)(int, char);")));
        }

        @Test
        void testQualifiedPointer() {
            assertEquals("const char *const s;\n", CSourceWriter.write(parse("const char * const s;")));
        }

        @Test
        void testPrototypeWithoutParameters() {
            assertEquals("int f(void);\n", CSourceWriter.write(parse("int f(void);")));
        }

        @Test
        void testTypeName() {
            final var type = new PointerType(new ArrayType(PrimitiveType.of(Primitive.INT), IntegerConstant.of(4)));
            assertEquals("int (*)[4]", CSourceWriter.write(type));
        }
    }

    @Nested
    final class Statements {

        @Test
        void testFunctionDefinition() {
            @Language("C")
            final var source = """
                int f(int x) {
                    return x + 1;
                }
                """;
            assertEquals(source + "\n", CSourceWriter.write(parse(source)));
        }

        @Test
        void testThenBranchIsBracedBeforeElse() {
            @Language("C")
            final var source = """
                void f(int x, int y) {
                    if (x) y = 1; else y = 2;
                }
                """;
            final var expected = """
                void f(int x, int y) {
                    if (x) {
                        y = 1;
                    } else
                        y = 2;
                }

                """;
            assertEquals(expected, CSourceWriter.write(parse(source)));
        }

        @Test
        void testElseIfChain() {
            @Language("C")
            final var source = """
                void f(int x, int y) {
                    if (x) { y = 1; } else if (y) y = 2; else { y = 3; }
                }
                """;
            final var expected = """
                void f(int x, int y) {
                    if (x) {
                        y = 1;
                    } else if (y) {
                        y = 2;
                    } else {
                        y = 3;
                    }
                }

                """;
            assertEquals(expected, CSourceWriter.write(parse(source)));
        }

        @Test
        void testLoops() {
            @Language("C")
            final var source = """
                int f(int n) {
                    int s = 0;
                    for (int i = 0; i < n; i++) {
                        s += i;
                    }
                    do {
                        s--;
                    } while (s > 10);
                    while (s < 0)
                        s = -s;
                    return s;
                }
                """;
            assertEquals(source + "\n", CSourceWriter.write(parse(source)));
        }

        @Test
        void testRewritingIsStable() {
            @Language("C")
            final var source = """
                struct point { int x; int y; };
                typedef unsigned long size;
                enum color { RED, GREEN = 4 };
                static int table[] = {1, 2, 3};

                int sum(struct point *p, size n) {
                    int total = 0;
                    while (n--)
                        total += p[n].x * (p[n].y - 1);
                    goto done;
                done:
                    return total ? total : GREEN;
                }
                """;
            final var once = CSourceWriter.write(parse(source));
            assertEquals(once, CSourceWriter.write(parse(once)));
        }
    }
}
