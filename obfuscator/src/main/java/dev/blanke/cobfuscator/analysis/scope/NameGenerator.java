package dev.blanke.cobfuscator.analysis.scope;

/**
 * Enumerates the shortest valid C identifiers in a fixed order: {@code a} to {@code Z}, then {@code aa}, {@code ab},
 * and so forth, skipping reserved names.
 */
public final class NameGenerator {

    private static final String FIRST = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final String REST = FIRST + "0123456789_";

    private long index;

    public String next() {
        while (true) {
            final var name = nameAt(index++);
            if (!Keywords.isReserved(name))
                return name;
        }
    }

    /**
     * Maps an index to a name, treating the name as a number with a first digit in base 52 and all further digits in
     * base 63.
     */
    static String nameAt(long index) {
        var count = (long) FIRST.length();
        int length = 1;
        while (index >= count) {
            index -= count;
            count *= REST.length();
            length++;
        }
        final var name = new char[length];
        for (int i = length - 1; i > 0; i--) {
            name[i] = REST.charAt((int) (index % REST.length()));
            index /= REST.length();
        }
        name[0] = FIRST.charAt((int) index);
        return new String(name);
    }
}
