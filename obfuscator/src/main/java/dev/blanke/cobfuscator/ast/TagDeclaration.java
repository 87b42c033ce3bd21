package dev.blanke.cobfuscator.ast;

/**
 * A declaration consisting of a type specifier only, such as {@code struct point { int x, y; };} or the forward
 * declaration {@code struct node;}.
 *
 * @param type Either a {@link StructType} or an {@link EnumType}.
 */
public record TagDeclaration(CType type) implements ExternalDeclaration, BlockItem {

    public TagDeclaration {
        if (!(type instanceof StructType) && !(type instanceof EnumType))
            throw new IllegalArgumentException("Tag declarations must declare a struct, union or enum");
    }
}
