package dev.blanke.cobfuscator.ast;

public enum StorageClass {

    NONE(""),
    AUTO("auto"),
    REGISTER("register"),
    STATIC("static"),
    EXTERN("extern");

    private final String keyword;

    StorageClass(final String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
