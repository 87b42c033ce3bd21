package dev.blanke.cobfuscator.ast;

import org.jetbrains.annotations.Nullable;

public record ReturnStatement(@Nullable Expression value) implements Statement {
}
