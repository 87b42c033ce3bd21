package dev.blanke.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A utility class for creating and inspecting syntax tree nodes.
 */
public final class Trees {

    private static final TreeTransformer COPIER = new TreeTransformer(true) {};

    // Prevent instantiation of utility class.
    private Trees() {
    }

    public static Identifier identifier(final String name) {
        return new Identifier(name);
    }

    /**
     * Creates an expression of type {@code int} with the passed value.
     *
     * @param value A value in the range of {@code int}.
     *
     * @return An {@link IntegerConstant} for non-negative values, otherwise its negation.
     */
    public static Expression integer(final long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Value out of range of int: " + value);
        if (value >= 0)
            return IntegerConstant.of(value);
        if (value == Integer.MIN_VALUE)
            return new BinaryExpression(BinaryOperator.SUBTRACT,
                new UnaryExpression(UnaryOperator.NEGATE, IntegerConstant.of(Integer.MAX_VALUE)), IntegerConstant.of(1));
        return new UnaryExpression(UnaryOperator.NEGATE, IntegerConstant.of(-value));
    }

    /**
     * Creates an {@code unsigned int} constant with the passed value.
     */
    public static IntegerConstant unsigned(final long value) {
        return new IntegerConstant(Long.toUnsignedString(value & 0xFFFF_FFFFL) + "u");
    }

    public static ExpressionStatement statement(final Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static AssignmentExpression assign(final Expression target, final Expression value) {
        return new AssignmentExpression(AssignmentOperator.ASSIGN, target, value);
    }

    public static BinaryExpression binary(final BinaryOperator operator, final Expression left,
                                          final Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static UnaryExpression not(final Expression operand) {
        return new UnaryExpression(UnaryOperator.LOGICAL_NOT, operand);
    }

    public static CastExpression cast(final Primitive primitive, final Expression operand) {
        return new CastExpression(new PrimitiveType(primitive), operand);
    }

    /**
     * Wraps the passed statements into a compound statement unless a single compound statement is passed.
     */
    public static CompoundStatement compound(final List<? extends BlockItem> items) {
        if (items.size() == 1 && items.get(0) instanceof CompoundStatement compound)
            return compound;
        return new CompoundStatement(new ArrayList<>(items));
    }

    public static Statement copy(final Statement statement) {
        return COPIER.transformStatement(statement);
    }

    public static Expression copy(final Expression expression) {
        return COPIER.transformExpression(expression);
    }

    public static CType copy(final CType type) {
        return COPIER.transformType(type);
    }

    public static List<BlockItem> copy(final List<? extends BlockItem> items) {
        final var copies = new ArrayList<BlockItem>(items.size());
        for (final var item : items)
            copies.addAll(COPIER.transformBlockItem(item));
        return copies;
    }

    /**
     * Splits a narrow string literal into one character constant per character it denotes, keeping escape sequences
     * in their source spelling. The terminating null character is not included.
     *
     * @throws IllegalArgumentException If the literal carries an encoding prefix.
     */
    public static List<CharacterConstant> characters(final StringLiteral literal) {
        final var text = literal.text();
        if (!text.startsWith("\""))
            throw new IllegalArgumentException("Not a narrow string literal: " + text);

        final var characters = new ArrayList<CharacterConstant>();
        final int end = text.length() - 1;
        for (int i = 1; i < end; ) {
            final int start = i;
            if (text.charAt(i) == '\\') {
                final char escaped = text.charAt(i + 1);
                i += 2;
                if (escaped == 'x') {
                    while (i < end && Character.digit(text.charAt(i), 16) >= 0)
                        ++i;
                } else if (escaped >= '0' && escaped <= '7') {
                    while (i < end && i < start + 4 && text.charAt(i) >= '0' && text.charAt(i) <= '7')
                        ++i;
                }
            } else
                ++i;
            final var spelling = text.substring(start, i);
            characters.add(new CharacterConstant("'" + (spelling.equals("'") ? "\\'" : spelling) + "'"));
        }
        return characters;
    }

    /**
     * Strips top-level qualifiers from the passed type.
     */
    public static CType unqualified(final CType type) {
        return (type instanceof QualifiedType qualified) ? unqualified(qualified.type()) : type;
    }

    public static boolean isQualified(final CType type, final Qualifier qualifier) {
        return (type instanceof QualifiedType qualified)
            && (qualified.has(qualifier) || isQualified(qualified.type(), qualifier));
    }

    /**
     * Whether the passed statement contains a {@code case} or {@code default} label which is not enclosed by a
     * {@code switch} statement within the passed statement itself.
     */
    public static boolean containsOpenSwitchLabel(final Statement statement) {
        final var finder = new TreeVisitor() {

            boolean found;

            @Override
            public void visitCaseStatement(final CaseStatement statement) {
                found = true;
            }

            @Override
            public void visitDefaultStatement(final DefaultStatement statement) {
                found = true;
            }

            @Override
            public void visitSwitchStatement(final SwitchStatement statement) {
                // Labels below belong to the nested switch.
            }

            @Override
            public void visitExpression(final Expression expression) {
            }
        };
        finder.visitStatement(statement);
        return finder.found;
    }

    /**
     * Collects the names of all labels defined within the passed block items.
     */
    public static List<String> labelsIn(final List<? extends BlockItem> items) {
        final var labels = new ArrayList<String>();
        final var collector = new TreeVisitor() {

            @Override
            public void visitLabeledStatement(final LabeledStatement statement) {
                labels.add(statement.label());
                super.visitLabeledStatement(statement);
            }

            @Override
            public void visitExpression(final Expression expression) {
            }
        };
        for (final var item : items)
            collector.visitBlockItem(item);
        return labels;
    }
}
