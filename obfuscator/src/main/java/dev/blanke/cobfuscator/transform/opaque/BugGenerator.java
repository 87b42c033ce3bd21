package dev.blanke.cobfuscator.transform.opaque;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

import dev.blanke.cobfuscator.analysis.AnalysisException;
import dev.blanke.cobfuscator.analysis.expression.ExpressionAnalysis;
import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.Designator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.TreeTransformer;
import dev.blanke.cobfuscator.ast.Trees;

/**
 * Copies code of the original tree, giving every label defined in the copy a fresh name. Mutated copies additionally
 * have operators swapped and integer constants changed, serving as plausible dead code.
 * <p>
 * Constants in types, case labels and designators are never changed, as they must stay valid constant expressions.
 * Arithmetic operators are only swapped between arithmetic operands and relational operators only between arithmetic
 * operands, so a mutated copy remains well-typed.
 */
final class BugGenerator extends TreeTransformer {

    private static final Logger LOGGER = System.getLogger(BugGenerator.class.getName());

    private static final double REPLACE_OPERATOR_PROBABILITY = 0.5;

    private static final double CHANGE_CONSTANT_PROBABILITY = 0.4;

    private static final int[] CONSTANT_OFFSETS = { -3, -2, -1, 1, 2, 3 };

    private final ExpressionAnalysis expressions;

    private final NameAllocator names;

    private final Random random;

    private final Map<String, String> labels = new HashMap<>();

    private boolean mutating;

    /**
     * Whether the current copy already differs from the original. The first opportunity is always taken.
     */
    private boolean changed;

    BugGenerator(final ExpressionAnalysis expressions, final NameAllocator names, final Random random) {
        super(true);
        this.expressions = expressions;
        this.names       = names;
        this.random      = random;
    }

    List<BlockItem> copy(final List<? extends BlockItem> items) {
        return copy(items, false);
    }

    List<BlockItem> mutatedCopy(final List<? extends BlockItem> items) {
        return copy(items, true);
    }

    private List<BlockItem> copy(final List<? extends BlockItem> items, final boolean mutate) {
        labels.clear();
        for (final var label : Trees.labelsIn(items))
            labels.put(label, names.allocate(label));
        mutating = mutate;
        changed  = false;

        final var copy = new ArrayList<BlockItem>(items.size());
        for (final var item : items)
            copy.addAll(transformBlockItem(item));
        return copy;
    }

    private <T> T unmutated(final Supplier<T> action) {
        final var wasMutating = mutating;
        mutating = false;
        try {
            return action.get();
        } finally {
            mutating = wasMutating;
        }
    }

    private boolean takeChance(final double probability) {
        if (!mutating || (changed && random.nextDouble() >= probability))
            return false;
        changed = true;
        return true;
    }

    @Override
    public CType transformType(final CType type) {
        return unmutated(() -> super.transformType(type));
    }

    @Override
    public Designator transformDesignator(final Designator designator) {
        return unmutated(() -> super.transformDesignator(designator));
    }

    @Override
    public Statement transformCaseStatement(final CaseStatement statement) {
        final var value = unmutated(() -> transformExpression(statement.value()));
        return new CaseStatement(value, transformStatement(statement.body()));
    }

    @Override
    public Statement transformLabeledStatement(final LabeledStatement statement) {
        return new LabeledStatement(labels.getOrDefault(statement.label(), statement.label()),
            transformStatement(statement.body()));
    }

    @Override
    public Statement transformGotoStatement(final GotoStatement statement) {
        return new GotoStatement(labels.getOrDefault(statement.label(), statement.label()));
    }

    @Override
    public Expression transformExpression(final Expression expression) {
        if (expression instanceof IntegerConstant constant && constant.value() > 0 && constant.value() < Integer.MAX_VALUE
                && takeChance(CHANGE_CONSTANT_PROBABILITY)) {
            final var value = constant.value() + CONSTANT_OFFSETS[random.nextInt(CONSTANT_OFFSETS.length)];
            return new IntegerConstant(Math.max(1, value) + constant.suffix());
        }
        return super.transformExpression(expression);
    }

    @Override
    public Expression transformBinaryExpression(final BinaryExpression expression) {
        final var copy = (BinaryExpression) super.transformBinaryExpression(expression);
        final var replacements = replacementsOf(expression);
        if (replacements.length == 0 || !takeChance(REPLACE_OPERATOR_PROBABILITY))
            return copy;
        return Trees.binary(replacements[random.nextInt(replacements.length)], copy.left(), copy.right());
    }

    private BinaryOperator[] replacementsOf(final BinaryExpression expression) {
        final var arithmetic = isArithmetic(expression.left()) && isArithmetic(expression.right());
        return switch (expression.operator()) {
            case LESS, LESS_EQUAL -> arithmetic
                ? new BinaryOperator[] { BinaryOperator.GREATER, BinaryOperator.GREATER_EQUAL, BinaryOperator.NOT_EQUAL }
                : new BinaryOperator[0];
            case GREATER, GREATER_EQUAL -> arithmetic
                ? new BinaryOperator[] { BinaryOperator.LESS, BinaryOperator.LESS_EQUAL, BinaryOperator.NOT_EQUAL }
                : new BinaryOperator[0];
            case EQUAL -> arithmetic
                ? new BinaryOperator[] { BinaryOperator.NOT_EQUAL, BinaryOperator.LESS, BinaryOperator.GREATER }
                : new BinaryOperator[] { BinaryOperator.NOT_EQUAL };
            case NOT_EQUAL -> arithmetic
                ? new BinaryOperator[] { BinaryOperator.EQUAL, BinaryOperator.LESS, BinaryOperator.GREATER }
                : new BinaryOperator[] { BinaryOperator.EQUAL };
            case ADD      -> arithmetic ? new BinaryOperator[] { BinaryOperator.SUBTRACT } : new BinaryOperator[0];
            case SUBTRACT -> arithmetic ? new BinaryOperator[] { BinaryOperator.ADD } : new BinaryOperator[0];
            case MULTIPLY -> new BinaryOperator[] { BinaryOperator.ADD, BinaryOperator.SUBTRACT };
            case LOGICAL_AND -> new BinaryOperator[] { BinaryOperator.LOGICAL_OR };
            case LOGICAL_OR  -> new BinaryOperator[] { BinaryOperator.LOGICAL_AND };
            default -> new BinaryOperator[0];
        };
    }

    private boolean isArithmetic(final Expression operand) {
        try {
            return expressions.infoOf(operand).arithmeticType() != null;
        } catch (final AnalysisException exception) {
            LOGGER.log(Level.DEBUG, "Not swapping operator: {0}", exception.getMessage());
            return false;
        }
    }
}
