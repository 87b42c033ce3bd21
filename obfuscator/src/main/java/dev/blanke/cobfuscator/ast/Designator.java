package dev.blanke.cobfuscator.ast;

public interface Designator extends Node {
}
