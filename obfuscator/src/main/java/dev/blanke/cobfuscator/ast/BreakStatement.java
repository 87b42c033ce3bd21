package dev.blanke.cobfuscator.ast;

public record BreakStatement() implements Statement {
}
