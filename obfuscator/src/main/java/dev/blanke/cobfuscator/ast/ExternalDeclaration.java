package dev.blanke.cobfuscator.ast;

/**
 * A declaration or function definition appearing at file scope.
 */
public interface ExternalDeclaration extends Node {
}
