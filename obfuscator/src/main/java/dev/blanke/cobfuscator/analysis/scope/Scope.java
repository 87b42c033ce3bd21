package dev.blanke.cobfuscator.analysis.scope;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A region of the program in which declared names are visible.
 * <p>
 * Scopes are stored in an arena owned by the {@link ScopeModel} and refer to their enclosing scope directly. The end
 * position is only known once the analysis leaves the scope; afterwards a scope is immutable.
 */
public final class Scope {

    private final int id;

    private final @Nullable Scope parent;

    private final ScopeKind kind;

    private final int depth;

    private final int start;

    private int end = Integer.MAX_VALUE;

    Scope(final int id, final @Nullable Scope parent, final ScopeKind kind, final int start) {
        this.id     = id;
        this.parent = parent;
        this.kind   = Objects.requireNonNull(kind);
        this.depth  = (parent == null) ? 0 : parent.depth + 1;
        this.start  = start;
    }

    void close(final int end) {
        this.end = end;
    }

    public int getId() {
        return id;
    }

    public @Nullable Scope getParent() {
        return parent;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return Whether this scope is the passed scope or encloses it.
     */
    public boolean encloses(final Scope other) {
        for (Scope scope = other; scope != null; scope = scope.parent)
            if (scope == this)
                return true;
        return false;
    }

    /**
     * Returns the nearest scope, starting at this one, which can hold ordinary identifiers and tags. Member lists
     * cannot: a tag defined within a structure belongs to the scope enclosing the structure.
     */
    public Scope declaringScope() {
        Scope scope = this;
        while (scope.kind == ScopeKind.AGGREGATE)
            scope = Objects.requireNonNull(scope.parent);
        return scope;
    }

    @Override
    public String toString() {
        return kind + "#" + id;
    }
}
