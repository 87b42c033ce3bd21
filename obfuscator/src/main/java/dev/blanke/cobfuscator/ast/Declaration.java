package dev.blanke.cobfuscator.ast;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * The declaration of a single object or function name.
 * <p>
 * A declaration with several declarators such as {@code int a, *b;} is represented by one {@code Declaration} per
 * declarator. The same record is used for the members of a {@link StructType}.
 *
 * @param name The declared name.
 *
 * @param type The declared type.
 *
 * @param storage The storage-class specifier.
 *
 * @param initializer The initializer, or {@code null} if the declaration has none.
 */
public record Declaration(String name, CType type, StorageClass storage, @Nullable Initializer initializer)
        implements ExternalDeclaration, BlockItem {

    public Declaration {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        Objects.requireNonNull(storage);
    }

    public Declaration(final String name, final CType type) {
        this(name, type, StorageClass.NONE, null);
    }

    public Declaration(final String name, final CType type, final @Nullable Initializer initializer) {
        this(name, type, StorageClass.NONE, initializer);
    }
}
