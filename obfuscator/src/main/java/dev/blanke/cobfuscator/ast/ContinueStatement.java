package dev.blanke.cobfuscator.ast;

public record ContinueStatement() implements Statement {
}
