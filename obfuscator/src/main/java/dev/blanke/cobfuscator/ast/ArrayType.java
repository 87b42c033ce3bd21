package dev.blanke.cobfuscator.ast;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * An array type.
 *
 * @param element The type of the array elements.
 *
 * @param size The size expression, or {@code null} if the size is left unspecified (e.g. {@code int a[] = {1, 2}}).
 *             A size which is not an integer constant expression makes the array a variable-length array.
 */
public record ArrayType(CType element, @Nullable Expression size) implements CType {

    public ArrayType {
        Objects.requireNonNull(element);
    }
}
