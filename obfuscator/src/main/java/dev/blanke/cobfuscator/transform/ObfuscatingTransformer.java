package dev.blanke.cobfuscator.transform;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Objects;
import java.util.Random;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.AnalysisException;
import dev.blanke.cobfuscator.analysis.expression.ExpressionAnalysis;
import dev.blanke.cobfuscator.analysis.expression.ExpressionAnalyzer;
import dev.blanke.cobfuscator.analysis.expression.ExpressionInfo;
import dev.blanke.cobfuscator.analysis.scope.ScopeAnalyzer;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.TreeTransformer;

/**
 * The base of all tree transformers which consult the analyses of the tree they transform.
 * <p>
 * Both analyses are run on construction and describe the tree passed to the constructor only; an instance must thus
 * be used for transforming exactly that tree.
 */
public abstract class ObfuscatingTransformer extends TreeTransformer {

    private static final Logger LOGGER = System.getLogger(ObfuscatingTransformer.class.getName());

    protected final SourceUnit unit;

    protected final ScopeModel scopes;

    protected final ExpressionAnalysis expressions;

    protected final Random random;

    protected ObfuscatingTransformer(final SourceUnit unit, final Random random) {
        this.unit        = Objects.requireNonNull(unit);
        this.random      = Objects.requireNonNull(random);
        this.scopes      = ScopeAnalyzer.analyze(unit);
        this.expressions = ExpressionAnalyzer.analyze(unit, scopes);
    }

    /**
     * Looks up the information about an expression of the original tree.
     *
     * @return The information, or {@code null} if the expression is unknown to the analysis, in which case the site
     *         must be left untouched.
     */
    protected @Nullable ExpressionInfo infoOf(final Expression expression) {
        try {
            return expressions.infoOf(expression);
        } catch (final AnalysisException exception) {
            LOGGER.log(Level.DEBUG, "Skipping site: {0}", exception.getMessage());
            return null;
        }
    }

    public SourceUnit transform() {
        return transformSourceUnit(unit);
    }
}
