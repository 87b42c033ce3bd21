package dev.blanke.cobfuscator.ast;

import java.util.List;

public record CompoundStatement(List<BlockItem> items) implements Statement {

    public CompoundStatement {
        items = List.copyOf(items);
    }

    public CompoundStatement(final BlockItem... items) {
        this(List.of(items));
    }
}
