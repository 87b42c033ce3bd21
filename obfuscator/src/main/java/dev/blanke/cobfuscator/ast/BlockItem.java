package dev.blanke.cobfuscator.ast;

/**
 * An item of a {@link CompoundStatement}, that is either a {@link Statement} or a local declaration.
 */
public interface BlockItem extends Node {
}
