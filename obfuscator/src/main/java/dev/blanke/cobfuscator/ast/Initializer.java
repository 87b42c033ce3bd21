package dev.blanke.cobfuscator.ast;

/**
 * The initializer of a declaration: either a single {@link Expression}, an {@link InitializerList}, or, as an element
 * of an {@code InitializerList}, a {@link DesignatedInitializer}.
 */
public interface Initializer extends Node {
}
