package dev.blanke.cobfuscator.analysis.scope;

import java.util.Set;

/**
 * A utility class listing the names generated identifiers must never take.
 */
public final class Keywords {

    private static final Set<String> RESERVED = Set.of(
        "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum", "extern",
        "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return", "short", "signed",
        "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
        "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary", "_Noreturn",
        "_Static_assert", "_Thread_local",
        // Common extensions and names with a meaning to the compiler or linker.
        "asm", "typeof", "main", "alloca");

    // Prevent instantiation of utility class.
    private Keywords() {
    }

    public static boolean isReserved(final String name) {
        return RESERVED.contains(name) || name.startsWith("__") || name.startsWith("_") && name.length() > 1
            && Character.isUpperCase(name.charAt(1));
    }
}
