package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A function definition. Its parameters and the outermost block of its body share one scope.
 */
public record FunctionDefinition(String name, FunctionType type, StorageClass storage, CompoundStatement body)
        implements ExternalDeclaration {

    public FunctionDefinition {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        Objects.requireNonNull(storage);
        Objects.requireNonNull(body);
    }

    public FunctionDefinition(final String name, final FunctionType type, final CompoundStatement body) {
        this(name, type, StorageClass.NONE, body);
    }

    public FunctionDefinition withBody(final CompoundStatement body) {
        return new FunctionDefinition(name, type, storage, body);
    }
}
