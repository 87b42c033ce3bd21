package dev.blanke.cobfuscator.ast;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A {@code struct} or {@code union} type specifier.
 * <p>
 * A specifier with a member list defines the aggregate; one without only refers to an aggregate defined elsewhere
 * (or declares it as incomplete type).
 *
 * @param union Whether this is a {@code union} rather than a {@code struct}.
 *
 * @param tag The tag of the aggregate, {@code null} for anonymous aggregates.
 *
 * @param members The member declarations, or {@code null} if this specifier only references the aggregate.
 */
public record StructType(boolean union, @Nullable String tag, @Nullable List<Declaration> members) implements CType {

    public StructType {
        if (tag == null && members == null)
            throw new IllegalArgumentException("Anonymous aggregates must declare their members");
        if (members != null)
            members = List.copyOf(members);
    }

    public boolean isDefinition() {
        return members != null;
    }

    public String keyword() {
        return union ? "union" : "struct";
    }
}
