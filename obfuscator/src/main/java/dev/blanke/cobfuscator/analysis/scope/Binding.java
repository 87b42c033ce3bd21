package dev.blanke.cobfuscator.analysis.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.StorageClass;

/**
 * A single declared name together with everything the analysis learned about it.
 * <p>
 * Several declarations of the same entity, such as a prototype followed by the function definition, share one
 * binding. Bindings are only mutated by the {@link ScopeAnalyzer} and are read-only afterwards.
 */
public final class Binding {

    private final int id;

    private final String name;

    private final NameSpace nameSpace;

    private final BindingKind kind;

    private final Scope scope;

    /**
     * The position from which on the binding is visible within its {@link #scope}.
     */
    private final int declaredAt;

    private @Nullable CType type;

    private StorageClass storage;

    /**
     * The node of the definition, or of the first declaration if the entity is not defined in the translation unit.
     */
    private Node declaration;

    private boolean defined;

    private boolean initialized;

    /**
     * The position from which on the variable holds a determinate value, once its initializer has been evaluated.
     */
    private int initializedAt = Integer.MAX_VALUE;

    private final List<Occurrence> occurrences = new ArrayList<>();

    Binding(final int           id,
            final String        name,
            final NameSpace     nameSpace,
            final BindingKind   kind,
            final Scope         scope,
            final int           declaredAt,
            final @Nullable CType type,
            final StorageClass  storage,
            final Node          declaration) {
        this.id          = id;
        this.name        = Objects.requireNonNull(name);
        this.nameSpace   = Objects.requireNonNull(nameSpace);
        this.kind        = Objects.requireNonNull(kind);
        this.scope       = Objects.requireNonNull(scope);
        this.declaredAt  = declaredAt;
        this.type        = type;
        this.storage     = Objects.requireNonNull(storage);
        this.declaration = Objects.requireNonNull(declaration);
    }

    //region Mutators used during analysis
    void addOccurrence(final Occurrence occurrence) {
        occurrences.add(occurrence);
    }

    void define(final Node declaration, final @Nullable CType type) {
        this.declaration = declaration;
        this.defined     = true;
        if (type != null)
            this.type = type;
    }

    void setStorage(final StorageClass storage) {
        this.storage = storage;
    }

    void markInitialized(final int position) {
        initialized   = true;
        initializedAt = position;
    }
    //endregion

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NameSpace getNameSpace() {
        return nameSpace;
    }

    public BindingKind getKind() {
        return kind;
    }

    public Scope getScope() {
        return scope;
    }

    public int getDeclaredAt() {
        return declaredAt;
    }

    public @Nullable CType getType() {
        return type;
    }

    public StorageClass getStorage() {
        return storage;
    }

    public Node getDeclaration() {
        return declaration;
    }

    /**
     * @return Whether the translation unit contains a definition of the entity, as opposed to a declaration only.
     *         Always {@code true} for bindings without linkage.
     */
    public boolean isDefined() {
        return defined;
    }

    /**
     * @return Whether the variable is guaranteed to hold a determinate value once its declaration has been passed,
     *         i.e. it is a parameter, has static storage duration, or was declared with an initializer.
     */
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return Whether the variable holds a determinate value at the passed point, which excludes points within its own
     *         initializer.
     */
    public boolean isInitializedAt(final ProgramPoint point) {
        return initialized && point.position() >= initializedAt;
    }

    public List<Occurrence> getOccurrences() {
        return Collections.unmodifiableList(occurrences);
    }

    /**
     * @return Whether the binding is an object with static storage duration, i.e. a file-scope variable or a
     *         {@code static} local variable.
     */
    public boolean hasStaticStorage() {
        return kind == BindingKind.VARIABLE
            && (scope.getKind() == ScopeKind.FILE || storage == StorageClass.STATIC || storage == StorageClass.EXTERN);
    }

    /**
     * @return Whether the binding is a parameter or local variable with automatic storage duration.
     */
    public boolean isAutomatic() {
        return kind == BindingKind.VARIABLE && !hasStaticStorage() && scope.getKind() != ScopeKind.PROTOTYPE;
    }

    public LivenessRange getLivenessRange() {
        int end = declaredAt;
        for (final var occurrence : occurrences)
            end = Math.max(end, occurrence.point().position());
        if (nameSpace == NameSpace.LABEL)
            end = Math.max(end, scope.getEnd());
        return new LivenessRange(declaredAt, end);
    }

    @Override
    public String toString() {
        return nameSpace + " " + kind + " '" + name + "' in " + scope;
    }
}
