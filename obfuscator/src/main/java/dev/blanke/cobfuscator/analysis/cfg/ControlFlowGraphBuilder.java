package dev.blanke.cobfuscator.analysis.cfg;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.MalformedTreeException;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.BreakStatement;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.ContinueStatement;
import dev.blanke.cobfuscator.ast.DefaultStatement;
import dev.blanke.cobfuscator.ast.DoWhileStatement;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.ExpressionStatement;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.ReturnStatement;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.SwitchStatement;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.WhileStatement;

/**
 * Builds the {@link ControlFlowGraph} of a function definition.
 * <p>
 * A new block starts at every label, {@code case} and {@code default} label, loop header and branch target, as well as
 * after every statement transferring control. Blocks are numbered in the order in which they start in the source, so
 * the ids of blocks referenced before they start, such as the block following an {@code if} statement, are only known
 * once the whole function has been traversed.
 * <p>
 * Blocks which are unreachable are retained if they hold statements or labels. Empty blocks without predecessors,
 * such as the join point of an {@code if} statement whose branches both return, are dropped.
 */
public final class ControlFlowGraphBuilder {

    private static final Logger LOGGER = System.getLogger(ControlFlowGraphBuilder.class.getName());

    /**
     * A block under construction. Terminators refer to blocks by their {@link #key} until the final ids are known.
     */
    private static final class PendingBlock {

        private final int key;

        private final List<BlockItem> statements = new ArrayList<>();

        private @Nullable Terminator terminator;

        private boolean started;

        private boolean labeled;

        PendingBlock(final int key) {
            this.key = key;
        }
    }

    /**
     * A jump target whose block is only created once the first jump to it is recorded.
     */
    private final class Target {

        private @Nullable PendingBlock block;

        Target() {
        }

        Target(final PendingBlock block) {
            this.block = block;
        }

        PendingBlock get() {
            if (block == null)
                block = create();
            return block;
        }

        boolean isReferenced() {
            return block != null;
        }
    }

    private static final class SwitchContext {

        private final List<Expression> caseValues = new ArrayList<>();

        private final List<PendingBlock> caseBlocks = new ArrayList<>();

        private @Nullable PendingBlock defaultBlock;
    }

    private final FunctionDefinition function;

    private final Set<String> definedLabels;

    private final List<PendingBlock> created = new ArrayList<>();

    private final List<PendingBlock> started = new ArrayList<>();

    private final Map<String, Target> labels = new HashMap<>();

    private final Deque<Target> breakTargets = new ArrayDeque<>();

    private final Deque<Target> continueTargets = new ArrayDeque<>();

    private final Deque<SwitchContext> switches = new ArrayDeque<>();

    private @Nullable PendingBlock current;

    private ControlFlowGraphBuilder(final FunctionDefinition function) {
        this.function      = function;
        this.definedLabels = new HashSet<>(Trees.labelsIn(function.body().items()));
    }

    /**
     * @throws MalformedTreeException If the function jumps to an undefined label, defines a label twice, or contains
     *                                a {@code break}, {@code continue}, {@code case} or {@code default} statement
     *                                outside of its enclosing statement.
     */
    public static ControlFlowGraph build(final FunctionDefinition function) {
        final var builder = new ControlFlowGraphBuilder(function);
        builder.start(builder.create());
        for (final var item : function.body().items())
            builder.buildItem(item);
        if (builder.current != null)
            builder.terminate(new Return(null, true));

        final var graph = builder.finish();
        LOGGER.log(Level.DEBUG, "Built control-flow graph of ''{0}'' with {1} blocks", function.name(),
            graph.blocks().size());
        return graph;
    }

    //region Blocks
    private PendingBlock create() {
        final var block = new PendingBlock(created.size());
        created.add(block);
        return block;
    }

    /**
     * Starts the passed block. If control can reach the end of the current block, it falls through into the new one.
     */
    private void start(final PendingBlock block) {
        if (block.started)
            throw new IllegalStateException("Block " + block.key + " has already been started");
        if (current != null)
            current.terminator = new Fallthrough(block.key);
        block.started = true;
        started.add(block);
        current = block;
    }

    /**
     * Returns the current block, starting a new, unreachable block if the previous statement transferred control.
     */
    private PendingBlock currentBlock() {
        if (current == null)
            start(create());
        return current;
    }

    private void terminate(final Terminator terminator) {
        currentBlock().terminator = terminator;
        current = null;
    }

    private void jump(final PendingBlock target) {
        terminate(new Jump(target.key));
    }
    //endregion

    //region Statements
    private void buildItem(final BlockItem item) {
        if (item instanceof Statement statement)
            buildStatement(statement);
        else
            currentBlock().statements.add(item);
    }

    private void buildStatement(final Statement statement) {
        if (statement instanceof CompoundStatement compound)
            compound.items().forEach(this::buildItem);
        else if (statement instanceof ExpressionStatement)
            currentBlock().statements.add(statement);
        else if (statement instanceof IfStatement ifStatement)
            buildIf(ifStatement);
        else if (statement instanceof WhileStatement whileStatement)
            buildWhile(whileStatement);
        else if (statement instanceof DoWhileStatement doWhile)
            buildDoWhile(doWhile);
        else if (statement instanceof ForStatement forStatement)
            buildFor(forStatement);
        else if (statement instanceof SwitchStatement switchStatement)
            buildSwitch(switchStatement);
        else if (statement instanceof CaseStatement caseStatement)
            buildCase(caseStatement);
        else if (statement instanceof DefaultStatement defaultStatement)
            buildDefault(defaultStatement);
        else if (statement instanceof LabeledStatement labeled)
            buildLabeled(labeled);
        else if (statement instanceof GotoStatement gotoStatement) {
            if (!definedLabels.contains(gotoStatement.label()))
                throw new MalformedTreeException("Jump to undefined label '" + gotoStatement.label() + "' in function '"
                    + function.name() + "'");
            jump(label(gotoStatement.label()).get());
        } else if (statement instanceof BreakStatement) {
            if (breakTargets.isEmpty())
                throw new MalformedTreeException("break outside of loop or switch in '" + function.name() + "'");
            jump(breakTargets.peek().get());
        } else if (statement instanceof ContinueStatement) {
            if (continueTargets.isEmpty())
                throw new MalformedTreeException("continue outside of loop in '" + function.name() + "'");
            jump(continueTargets.peek().get());
        } else if (statement instanceof ReturnStatement returnStatement)
            terminate(new Return(returnStatement.value(), false));
        else
            throw new IllegalArgumentException("Unknown statement: " + statement);
    }

    private void buildIf(final IfStatement statement) {
        final var join      = new Target();
        final var whenTrue  = create();
        final var whenFalse = (statement.elseStatement() != null) ? create() : join.get();
        terminate(new Branch(statement.condition(), whenTrue.key, whenFalse.key));

        start(whenTrue);
        buildStatement(statement.thenStatement());
        if (statement.elseStatement() != null) {
            if (current != null)
                jump(join.get());
            start(whenFalse);
            buildStatement(statement.elseStatement());
        }
        if (current != null || join.isReferenced())
            start(join.get());
    }

    private void buildWhile(final WhileStatement statement) {
        final var header = create();
        final var body   = create();
        final var exit   = new Target();
        start(header);
        terminate(new Branch(statement.condition(), body.key, exit.get().key));

        loopBody(body, statement.body(), exit, new Target(header));
        if (current != null)
            jump(header);
        start(exit.get());
    }

    private void buildDoWhile(final DoWhileStatement statement) {
        final var body      = create();
        final var condition = new Target();
        final var exit      = new Target();
        start(body);
        loopBody(null, statement.body(), exit, condition);

        if (current != null || condition.isReferenced()) {
            start(condition.get());
            terminate(new Branch(statement.condition(), body.key, exit.get().key));
        }
        if (exit.isReferenced())
            start(exit.get());
    }

    private void buildFor(final ForStatement statement) {
        final var block = currentBlock();
        block.statements.addAll(statement.declarations());
        if (statement.initializer() != null)
            block.statements.add(Trees.statement(statement.initializer()));

        final var header = create();
        final var body   = create();
        final var exit   = new Target();
        start(header);
        if (statement.condition() != null)
            terminate(new Branch(statement.condition(), body.key, exit.get().key));

        final var step = (statement.step() != null) ? new Target() : new Target(header);
        loopBody(body, statement.body(), exit, step);
        if (statement.step() != null) {
            if (current != null || step.isReferenced()) {
                start(step.get());
                currentBlock().statements.add(Trees.statement(statement.step()));
                jump(header);
            }
        } else if (current != null)
            jump(header);
        if (exit.isReferenced())
            start(exit.get());
    }

    /**
     * Builds the body of a loop.
     *
     * @param body The block to start the body in, or {@code null} if the current block already is the body block.
     */
    private void loopBody(final @Nullable PendingBlock body, final Statement statement, final Target exit,
                          final Target next) {
        breakTargets.push(exit);
        continueTargets.push(next);
        if (body != null)
            start(body);
        buildStatement(statement);
        continueTargets.pop();
        breakTargets.pop();
    }

    private void buildSwitch(final SwitchStatement statement) {
        final var dispatch = currentBlock();
        current = null;

        final var context = new SwitchContext();
        final var exit    = new Target();
        switches.push(context);
        breakTargets.push(exit);
        buildStatement(statement.body());
        breakTargets.pop();
        switches.pop();

        final var cases = new ArrayList<SwitchDispatch.Case>(context.caseValues.size());
        for (int i = 0; i < context.caseValues.size(); i++)
            cases.add(new SwitchDispatch.Case(context.caseValues.get(i), context.caseBlocks.get(i).key));
        final var defaultBlock = (context.defaultBlock != null) ? context.defaultBlock : exit.get();
        dispatch.terminator = new SwitchDispatch(statement.selector(), cases, defaultBlock.key);

        if (current != null || exit.isReferenced())
            start(exit.get());
    }

    private SwitchContext enclosingSwitch(final String label) {
        final var context = switches.peek();
        if (context == null)
            throw new MalformedTreeException(label + " label outside of switch in '" + function.name() + "'");
        return context;
    }

    private void buildCase(final CaseStatement statement) {
        final var context = enclosingSwitch("case");
        final var block = create();
        context.caseValues.add(statement.value());
        context.caseBlocks.add(block);
        block.labeled = true;
        start(block);
        buildStatement(statement.body());
    }

    private void buildDefault(final DefaultStatement statement) {
        final var context = enclosingSwitch("default");
        if (context.defaultBlock != null)
            throw new MalformedTreeException("Multiple default labels in one switch in '" + function.name() + "'");
        final var block = create();
        context.defaultBlock = block;
        block.labeled = true;
        start(block);
        buildStatement(statement.body());
    }

    private Target label(final String name) {
        return labels.computeIfAbsent(name, key -> new Target());
    }

    private void buildLabeled(final LabeledStatement statement) {
        final var block = label(statement.label()).get();
        if (block.started)
            throw new MalformedTreeException("Duplicate label '" + statement.label() + "' in function '"
                + function.name() + "'");
        block.labeled = true;
        start(block);
        buildStatement(statement.body());
    }
    //endregion

    /**
     * Drops empty unreachable blocks and assigns the final ids in the order the blocks were started.
     */
    private ControlFlowGraph finish() {
        final var retained = new ArrayList<>(started);
        boolean changed;
        do {
            final var targets = new HashSet<Integer>();
            for (final var block : retained)
                targets.addAll(block.terminator.successors());
            changed = retained.removeIf(block -> block != started.get(0) && block.statements.isEmpty()
                && !block.labeled && !targets.contains(block.key));
        } while (changed);

        final var ids = new int[created.size()];
        Arrays.fill(ids, -1);
        for (int i = 0; i < retained.size(); i++)
            ids[retained.get(i).key] = i;

        final var blocks = new ArrayList<BasicBlock>(retained.size());
        for (final var block : retained)
            blocks.add(new BasicBlock(ids[block.key], block.statements, block.terminator.remap(key -> {
                if (ids[key] < 0)
                    throw new IllegalStateException("Jump to dropped block " + key + " in '" + function.name() + "'");
                return ids[key];
            })));
        return new ControlFlowGraph(function, blocks);
    }
}
