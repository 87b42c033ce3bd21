package dev.blanke.cobfuscator.analysis.scope;

import java.util.Objects;

import dev.blanke.cobfuscator.ast.Node;

/**
 * A single place in the tree where the name of a binding is written, be it its declaration or a use.
 *
 * @param node The node carrying the name, e.g. an {@link dev.blanke.cobfuscator.ast.Identifier} or a
 *             {@link dev.blanke.cobfuscator.ast.Declaration}.
 *
 * @param point The point at which the name occurs.
 */
public record Occurrence(Node node, ProgramPoint point) {

    public Occurrence {
        Objects.requireNonNull(node);
        Objects.requireNonNull(point);
    }
}
