package dev.blanke.cobfuscator.ast;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * An {@code enum} type specifier, either defining its enumerators or referencing an enumeration declared elsewhere.
 */
public record EnumType(@Nullable String tag, @Nullable List<Enumerator> enumerators) implements CType {

    public EnumType {
        if (tag == null && enumerators == null)
            throw new IllegalArgumentException("Anonymous enumerations must declare their enumerators");
        if (enumerators != null)
            enumerators = List.copyOf(enumerators);
    }

    public boolean isDefinition() {
        return enumerators != null;
    }
}
