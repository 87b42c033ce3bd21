package dev.blanke.cobfuscator.ast;

/**
 * A type as written in the source, i.e. before typedef names are expanded or struct references are resolved.
 */
public interface CType extends Node {
}
