package dev.blanke.cobfuscator.analysis.scope;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers which collide with no name used anywhere in a translation unit, nor with any identifier
 * handed out before by the same allocator.
 * <p>
 * Such names are safe at every program point and in every namespace, which is what transformations need for the
 * helper variables, labels and parameters they introduce.
 */
public final class NameAllocator {

    private final Set<String> taken;

    public NameAllocator(final ScopeModel model) {
        taken = new HashSet<>(model.getNames());
    }

    /**
     * Returns {@code base} if it is still available, otherwise {@code base} followed by the smallest number making it
     * available.
     */
    public String allocate(final String base) {
        var name = base;
        for (int suffix = 1; taken.contains(name) || Keywords.isReserved(name); suffix++)
            name = base + suffix;
        taken.add(name);
        return name;
    }

    public void reserve(final String name) {
        taken.add(name);
    }

    public boolean isTaken(final String name) {
        return taken.contains(name);
    }
}
