package dev.blanke.cobfuscator.transform.opaque;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Random;
import java.util.Set;

import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.ConditionalExpression;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.DoWhileStatement;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.WhileStatement;
import dev.blanke.cobfuscator.transform.ObfuscatingTransformer;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * Combines the conditions of existing {@code if}, {@code while}, {@code do}-{@code while} and {@code for} statements
 * and conditional expressions with opaque predicates: a condition {@code c} becomes {@code P && c}, {@code c && P},
 * {@code F || c} or {@code c || F} for a true predicate {@code P} or a false predicate {@code F}, which leaves its
 * value and the evaluation of its side effects unchanged.
 */
public final class OpaqueAugmentation implements Transform {

    private static final Logger LOGGER = System.getLogger(OpaqueAugmentation.class.getName());

    private final Set<PredicateStyle> styles;

    private final double probability;

    private final int number;

    /**
     * @param probability The probability of augmenting a condition.
     *
     * @param number The number of predicates combined with each augmented condition.
     */
    public OpaqueAugmentation(final Set<PredicateStyle> styles, final double probability, final int number) {
        this.styles      = Set.copyOf(styles);
        this.probability = probability;
        this.number      = number;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        if (styles.isEmpty() || probability == 0 || number == 0)
            return unit;
        return new AugmentingTransformer(unit, random).transform();
    }

    private final class AugmentingTransformer extends ObfuscatingTransformer {

        private final PredicateSynthesizer predicates;

        private int augmented;

        private boolean inFunction;

        private boolean inStaticInitializer;

        AugmentingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
            predicates = new PredicateSynthesizer(scopes, expressions.getTypes(), new NameAllocator(scopes), random,
                styles);
        }

        @Override
        public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
            augmented  = 0;
            inFunction = true;
            final FunctionDefinition transformed;
            try {
                transformed = super.transformFunctionDefinition(function);
            } finally {
                inFunction = false;
            }
            final var entropic = predicates.takeEntropicDeclarations();
            LOGGER.log(Level.DEBUG, "Augmented {0} condition(s) of ''{1}''", augmented, function.name());
            if (entropic.isEmpty())
                return transformed;

            final var items = new ArrayList<>(entropic);
            items.addAll(transformed.body().items());
            return new FunctionDefinition(transformed.name(), transformed.type(), transformed.storage(),
                new CompoundStatement(items));
        }

        /**
         * Decides whether to augment a condition and does so.
         *
         * @param original    The condition in the original tree.
         * @param transformed The transformed condition.
         */
        private Expression augment(final Expression original, final Expression transformed) {
            if (random.nextDouble() >= probability)
                return transformed;

            final var point = scopes.pointOf(original);
            var condition = transformed;
            for (int i = 0; i < number; i++) {
                final var isTrue = random.nextBoolean();
                final var isBefore = random.nextBoolean();
                final var predicate = isTrue ? predicates.alwaysTrue(point) : predicates.alwaysFalse(point);
                if (predicate == null)
                    break;
                final var operator = isTrue ? BinaryOperator.LOGICAL_AND : BinaryOperator.LOGICAL_OR;
                condition = isBefore
                    ? Trees.binary(operator, predicate, condition)
                    : Trees.binary(operator, condition, predicate);
            }
            if (condition != transformed)
                augmented++;
            return condition;
        }

        @Override
        public Statement transformIfStatement(final IfStatement statement) {
            final var transformed = (IfStatement) super.transformIfStatement(statement);
            return new IfStatement(augment(statement.condition(), transformed.condition()),
                transformed.thenStatement(), transformed.elseStatement());
        }

        @Override
        public Statement transformWhileStatement(final WhileStatement statement) {
            final var transformed = (WhileStatement) super.transformWhileStatement(statement);
            return new WhileStatement(augment(statement.condition(), transformed.condition()), transformed.body());
        }

        @Override
        public Statement transformDoWhileStatement(final DoWhileStatement statement) {
            final var transformed = (DoWhileStatement) super.transformDoWhileStatement(statement);
            return new DoWhileStatement(transformed.body(), augment(statement.condition(), transformed.condition()));
        }

        @Override
        public Statement transformForStatement(final ForStatement statement) {
            final var transformed = (ForStatement) super.transformForStatement(statement);
            if (statement.condition() == null)
                return transformed;
            return new ForStatement(transformed.declarations(), transformed.initializer(),
                augment(statement.condition(), transformed.condition()), transformed.step(), transformed.body());
        }

        @Override
        public Declaration transformDeclaration(final Declaration declaration) {
            final var wasInStaticInitializer = inStaticInitializer;
            inStaticInitializer = declaration.storage() == StorageClass.STATIC
                || declaration.storage() == StorageClass.EXTERN;
            try {
                return super.transformDeclaration(declaration);
            } finally {
                inStaticInitializer = wasInStaticInitializer;
            }
        }

        /**
         * Augments conditional expressions evaluated at runtime only, as constant expressions must stay constant.
         */
        @Override
        public Expression transformConditionalExpression(final ConditionalExpression expression) {
            final var transformed = (ConditionalExpression) super.transformConditionalExpression(expression);
            if (!inFunction || inStaticInitializer || expressions.getTypes().isIntegerConstantExpression(expression))
                return transformed;
            return new ConditionalExpression(augment(expression.condition(), transformed.condition()),
                transformed.whenTrue(), transformed.whenFalse());
        }
    }
}
