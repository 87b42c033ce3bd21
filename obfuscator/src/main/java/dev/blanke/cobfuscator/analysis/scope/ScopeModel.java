package dev.blanke.cobfuscator.analysis.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.AnalysisException;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.StructType;

/**
 * The result of a {@link ScopeAnalyzer} run: all scopes and bindings of a translation unit, the binding each name
 * occurrence resolves to, and the program point of every statement and expression.
 * <p>
 * A {@code ScopeModel} describes exactly one tree. It must be discarded as soon as the tree is transformed, since the
 * new tree consists, at least partly, of nodes it knows nothing about.
 */
public final class ScopeModel {

    private final List<Scope> scopes;

    private final List<Binding> bindings;

    private final Map<Node, Binding> resolutions;

    private final Map<Node, ProgramPoint> points;

    private final Map<StructType, Scope> aggregateScopes;

    private final Map<FunctionDefinition, Scope> functionScopes;

    private final Set<String> unresolvedNames;

    private final Set<String> memberNames;

    private final Map<String, List<Binding>> bindingsByName = new TreeMap<>();

    ScopeModel(final List<Scope>                     scopes,
               final List<Binding>                   bindings,
               final Map<Node, Binding>              resolutions,
               final Map<Node, ProgramPoint>         points,
               final Map<StructType, Scope>          aggregateScopes,
               final Map<FunctionDefinition, Scope>  functionScopes,
               final Set<String>                     unresolvedNames,
               final Set<String>                     memberNames) {
        this.scopes          = List.copyOf(scopes);
        this.bindings        = List.copyOf(bindings);
        this.resolutions     = resolutions;
        this.points          = points;
        this.aggregateScopes = aggregateScopes;
        this.functionScopes  = functionScopes;
        this.unresolvedNames = Collections.unmodifiableSet(unresolvedNames);
        this.memberNames     = Collections.unmodifiableSet(memberNames);

        for (final var binding : bindings)
            bindingsByName.computeIfAbsent(binding.getName(), name -> new ArrayList<>()).add(binding);
    }

    public List<Scope> getScopes() {
        return scopes;
    }

    public Scope getFileScope() {
        return scopes.get(0);
    }

    /**
     * @return All bindings in the order of their first declaration.
     */
    public List<Binding> getBindings() {
        return bindings;
    }

    /**
     * @return The names of identifiers and typedef names for which no declaration was found, e.g. functions of the
     *         standard library.
     */
    public Set<String> getUnresolvedNames() {
        return unresolvedNames;
    }

    /**
     * Returns the binding the name carried by the passed node resolves to. Member names are not resolved by this
     * analysis, see {@link dev.blanke.cobfuscator.analysis.expression.ExpressionAnalysis#memberBindingOf(Node)}.
     */
    public @Nullable Binding bindingOf(final Node node) {
        return resolutions.get(node);
    }

    /**
     * Returns the program point of a statement, expression or declaration of the analyzed tree.
     *
     * @throws AnalysisException If the node is not part of the analyzed tree.
     */
    public ProgramPoint pointOf(final Node node) {
        final var point = points.get(node);
        if (point == null)
            throw new AnalysisException("No program point recorded for " + node);
        return point;
    }

    public Scope functionScopeOf(final FunctionDefinition function) {
        final var scope = functionScopes.get(function);
        if (scope == null)
            throw new AnalysisException("Function '" + function.name() + "' is not part of the analyzed tree");
        return scope;
    }

    public @Nullable Scope aggregateScopeOf(final StructType definition) {
        return aggregateScopes.get(definition);
    }

    public List<Binding> bindingsNamed(final String name) {
        return bindingsByName.getOrDefault(name, List.of());
    }

    /**
     * Returns the member named {@code name} of the aggregate whose definition is passed.
     */
    public @Nullable Binding member(final StructType definition, final String name) {
        final var scope = aggregateScopes.get(definition);
        if (scope == null)
            return null;
        for (final var binding : bindingsNamed(name))
            if (binding.getScope() == scope)
                return binding;
        return null;
    }

    /**
     * @return The names of all bindings, unresolved identifiers and accessed members. A name outside this set cannot
     *         collide with anything in the translation unit.
     */
    public Set<String> getNames() {
        final var names = new TreeSet<>(bindingsByName.keySet());
        names.addAll(unresolvedNames);
        names.addAll(memberNames);
        return names;
    }

    public boolean isVisible(final Binding binding, final ProgramPoint point) {
        return switch (binding.getNameSpace()) {
            case MEMBER   -> false;
            case LABEL    -> binding.getScope().encloses(point.scope());
            case ORDINARY, TAG -> binding.getScope().encloses(point.scope())
                && point.position() >= binding.getDeclaredAt();
        };
    }

    /**
     * Returns, per name, the innermost binding of the passed namespace visible at the passed point.
     */
    public List<Binding> visibleAt(final ProgramPoint point, final NameSpace nameSpace) {
        final var visible = new ArrayList<Binding>();
        for (final var candidates : bindingsByName.values()) {
            Binding innermost = null;
            for (final var binding : candidates)
                if (binding.getNameSpace() == nameSpace && isVisible(binding, point)
                        && (innermost == null || binding.getScope().getDepth() > innermost.getScope().getDepth()))
                    innermost = binding;
            if (innermost != null)
                visible.add(innermost);
        }
        return visible;
    }

    /**
     * Decides whether a new declaration named {@code name} can be introduced at the passed point, i.e. whether
     * {@code name} is free in {@code nameSpace} across all scopes simultaneously visible from that point.
     * <p>
     * This is the case if the name is not already declared in the scope of the point, no use of an outer binding of
     * that name follows the point within that scope (which the new declaration would capture), and no nested scope
     * declares the name (which would hide the new declaration from uses placed there).
     */
    public boolean isFree(final String name, final NameSpace nameSpace, final ProgramPoint point) {
        if (Keywords.isReserved(name) || unresolvedNames.contains(name))
            return false;

        final var scope = (nameSpace == NameSpace.LABEL)
            ? enclosingFunctionScope(point.scope()) : point.scope().declaringScope();
        if (scope == null)
            return false;
        for (final var binding : bindingsNamed(name)) {
            if (binding.getNameSpace() != nameSpace)
                continue;
            if (scope.encloses(binding.getScope()))
                return false;
            if (binding.getScope().encloses(scope))
                for (final var occurrence : binding.getOccurrences())
                    if (scope.encloses(occurrence.point().scope())
                            && occurrence.point().position() >= point.position())
                        return false;
        }
        return true;
    }

    /**
     * Decides whether the two bindings would interfere if they carried the same name, that is whether some occurrence
     * of either would then resolve to the other one.
     */
    public boolean conflicts(final Binding first, final Binding second) {
        if (first == second || first.getNameSpace() != second.getNameSpace())
            return false;
        if (first.getScope() == second.getScope())
            return true;
        if (first.getNameSpace() == NameSpace.MEMBER || first.getNameSpace() == NameSpace.LABEL)
            return false;
        return captures(first, second) || captures(second, first);
    }

    /**
     * Whether {@code other} would capture an occurrence of {@code binding} if both had the same name.
     */
    private boolean captures(final Binding binding, final Binding other) {
        if (other.getScope().getDepth() < binding.getScope().getDepth())
            return false;
        for (final var occurrence : binding.getOccurrences())
            if (isVisible(other, occurrence.point()))
                return true;
        return false;
    }

    public static @Nullable Scope enclosingFunctionScope(final Scope scope) {
        for (Scope current = scope; current != null; current = current.getParent())
            if (current.getKind() == ScopeKind.FUNCTION)
                return current;
        return null;
    }
}
