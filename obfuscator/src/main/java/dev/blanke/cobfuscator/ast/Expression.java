package dev.blanke.cobfuscator.ast;

public interface Expression extends Initializer {
}
