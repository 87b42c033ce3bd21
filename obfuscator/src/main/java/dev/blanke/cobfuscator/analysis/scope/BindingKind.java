package dev.blanke.cobfuscator.analysis.scope;

public enum BindingKind {
    VARIABLE,
    FUNCTION,
    TYPEDEF,
    ENUMERATOR,
    TAG,
    MEMBER,
    LABEL
}
