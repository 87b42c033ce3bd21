package dev.blanke.cobfuscator.ast;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A type with one or more qualifiers applied to it. Qualifying a {@link PointerType} qualifies the pointer itself
 * ({@code int *const p}); qualifying any other type qualifies the specifier ({@code const int x}).
 */
public record QualifiedType(Set<Qualifier> qualifiers, CType type) implements CType {

    public QualifiedType {
        if (qualifiers.isEmpty())
            throw new IllegalArgumentException("At least one qualifier is required");
        qualifiers = Collections.unmodifiableSet(EnumSet.copyOf(qualifiers));
        Objects.requireNonNull(type);
    }

    public QualifiedType(final Qualifier qualifier, final CType type) {
        this(EnumSet.of(qualifier), type);
    }

    public boolean has(final Qualifier qualifier) {
        return qualifiers.contains(qualifier);
    }
}
