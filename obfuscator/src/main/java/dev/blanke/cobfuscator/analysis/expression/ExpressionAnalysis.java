package dev.blanke.cobfuscator.analysis.expression;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.AnalysisException;
import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Node;

/**
 * The result of an {@link ExpressionAnalyzer} run: the type and effect of every expression of a translation unit and
 * the member each member access refers to.
 * <p>
 * Like the {@link ScopeModel} it builds upon, an {@code ExpressionAnalysis} describes exactly one tree and must not be
 * consulted for the nodes of a transformed tree.
 */
public final class ExpressionAnalysis {

    private final ScopeModel scopeModel;

    private final TypeResolver types;

    private final Map<Expression, ExpressionInfo> infos;

    private final Map<Node, Binding> memberBindings;

    private final Set<String> unresolvedMemberNames;

    private final Set<String> pureFunctions;

    ExpressionAnalysis(final ScopeModel                      scopeModel,
                       final TypeResolver                    types,
                       final Map<Expression, ExpressionInfo> infos,
                       final Map<Node, Binding>              memberBindings,
                       final Set<String>                     unresolvedMemberNames,
                       final Set<String>                     pureFunctions) {
        this.scopeModel            = scopeModel;
        this.types                 = types;
        this.infos                 = infos;
        this.memberBindings        = memberBindings;
        this.unresolvedMemberNames = Collections.unmodifiableSet(unresolvedMemberNames);
        this.pureFunctions         = pureFunctions;
    }

    public ScopeModel getScopeModel() {
        return scopeModel;
    }

    public TypeResolver getTypes() {
        return types;
    }

    /**
     * @throws AnalysisException If the expression is not part of the analyzed tree.
     */
    public ExpressionInfo infoOf(final Expression expression) {
        final var info = infos.get(expression);
        if (info == null)
            throw new AnalysisException("Expression is not part of the analyzed tree: " + expression);
        return info;
    }

    /**
     * Returns the member binding a {@link dev.blanke.cobfuscator.ast.MemberExpression} or
     * {@link dev.blanke.cobfuscator.ast.MemberDesignator} refers to.
     *
     * @return The binding of the member, or {@code null} if the aggregate it belongs to could not be determined.
     */
    public @Nullable Binding memberBindingOf(final Node node) {
        return memberBindings.get(node);
    }

    /**
     * @return The names of members accessed through an expression whose aggregate type could not be determined. Any
     *         member carrying such a name might be the one accessed.
     */
    public Set<String> getUnresolvedMemberNames() {
        return unresolvedMemberNames;
    }

    /**
     * @return Whether calls of the named function are {@link Effect#PURE} apart from the effects of their arguments.
     */
    public boolean isPureFunction(final String name) {
        return pureFunctions.contains(name);
    }
}
