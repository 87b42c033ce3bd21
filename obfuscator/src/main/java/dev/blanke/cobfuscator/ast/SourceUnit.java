package dev.blanke.cobfuscator.ast;

import java.util.List;

/**
 * The root of the syntax tree of a single, already preprocessed C translation unit.
 *
 * @param declarations The file-scope declarations and function definitions in source order.
 */
public record SourceUnit(List<ExternalDeclaration> declarations) implements Node {

    public SourceUnit {
        declarations = List.copyOf(declarations);
    }

    public SourceUnit(final ExternalDeclaration... declarations) {
        this(List.of(declarations));
    }
}
