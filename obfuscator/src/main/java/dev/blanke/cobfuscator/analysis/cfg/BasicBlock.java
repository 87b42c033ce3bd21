package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.Objects;

import dev.blanke.cobfuscator.ast.BlockItem;

/**
 * A maximal sequence of block items executed in order, entered only at its start and left only through its
 * {@link Terminator}.
 *
 * @param statements Declarations and expression statements. Compound statements are dissolved, and statements which
 *                   transfer control are expressed by the terminator.
 */
public record BasicBlock(int id, List<BlockItem> statements, Terminator terminator) {

    public BasicBlock {
        statements = List.copyOf(statements);
        Objects.requireNonNull(terminator);
    }
}
