package dev.blanke.cobfuscator.ast;

public enum Qualifier {

    CONST("const"),
    VOLATILE("volatile"),
    RESTRICT("restrict");

    private final String keyword;

    Qualifier(final String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
