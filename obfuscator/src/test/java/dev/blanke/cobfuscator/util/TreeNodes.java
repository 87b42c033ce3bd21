package dev.blanke.cobfuscator.util;

import java.util.ArrayList;
import java.util.List;

import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.TreeVisitor;

/**
 * A utility class for looking up nodes of a parsed tree.
 */
public final class TreeNodes {

    // Prevent instantiation of utility class.
    private TreeNodes() {
    }

    /**
     * Returns all statements, expressions and declarations of the passed type in source order.
     */
    public static <T extends Node> List<T> findAll(final SourceUnit unit, final Class<T> type) {
        final var found = new ArrayList<T>();
        new TreeVisitor() {

            @Override
            public void visitBlockItem(final BlockItem item) {
                if (!(item instanceof Statement) && !(item instanceof Declaration) && type.isInstance(item))
                    found.add(type.cast(item));
                super.visitBlockItem(item);
            }

            @Override
            public void visitDeclaration(final Declaration declaration) {
                if (type.isInstance(declaration))
                    found.add(type.cast(declaration));
                super.visitDeclaration(declaration);
            }

            @Override
            public void visitStatement(final Statement statement) {
                if (type.isInstance(statement))
                    found.add(type.cast(statement));
                super.visitStatement(statement);
            }

            @Override
            public void visitExpression(final Expression expression) {
                if (type.isInstance(expression))
                    found.add(type.cast(expression));
                super.visitExpression(expression);
            }
        }.visitSourceUnit(unit);
        return found;
    }

    public static <T extends Node> T findFirst(final SourceUnit unit, final Class<T> type) {
        final var found = findAll(unit, type);
        if (found.isEmpty())
            throw new IllegalArgumentException("No " + type.getSimpleName() + " in tree");
        return found.get(0);
    }

    /**
     * Returns all uses of the passed name as an identifier expression in source order.
     */
    public static List<Identifier> identifiersNamed(final SourceUnit unit, final String name) {
        return findAll(unit, Identifier.class).stream()
            .filter(identifier -> identifier.name().equals(name))
            .toList();
    }
}
