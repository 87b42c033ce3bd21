package dev.blanke.cobfuscator.analysis.cfg;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import dev.blanke.cobfuscator.ast.FunctionDefinition;

/**
 * The control-flow graph of a single function. The id of each block equals its index in {@link #blocks()}, and block
 * {@code 0} is the entry.
 */
public record ControlFlowGraph(FunctionDefinition function, List<BasicBlock> blocks) {

    public ControlFlowGraph {
        Objects.requireNonNull(function);
        blocks = List.copyOf(blocks);
        for (int i = 0; i < blocks.size(); i++)
            if (blocks.get(i).id() != i)
                throw new IllegalArgumentException("Block at index " + i + " has id " + blocks.get(i).id());
    }

    public BasicBlock entry() {
        return blocks.get(0);
    }

    public BasicBlock block(final int id) {
        return blocks.get(id);
    }

    public List<Integer> predecessorsOf(final int id) {
        final var predecessors = new ArrayList<Integer>();
        for (final var block : blocks)
            if (block.terminator().successors().contains(id))
                predecessors.add(block.id());
        return predecessors;
    }
}
