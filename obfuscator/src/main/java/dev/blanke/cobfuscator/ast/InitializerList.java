package dev.blanke.cobfuscator.ast;

import java.util.List;

public record InitializerList(List<Initializer> items) implements Initializer {

    public InitializerList {
        items = List.copyOf(items);
    }
}
