package dev.blanke.cobfuscator.ast;

/**
 * The common supertype of all nodes making up the syntax tree of a C translation unit.
 * <p>
 * All nodes are immutable. Transformations never modify a tree in place but produce a new tree which shares the
 * unchanged subtrees of the old one. Analyses attach their results to nodes by identity, so two structurally equal
 * nodes at different places in a tree must be distinct instances.
 *
 * @see TreeVisitor
 * @see TreeTransformer
 */
public interface Node {
}
