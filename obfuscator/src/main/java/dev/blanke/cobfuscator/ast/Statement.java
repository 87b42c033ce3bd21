package dev.blanke.cobfuscator.ast;

public interface Statement extends BlockItem {
}
