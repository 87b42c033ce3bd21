package dev.blanke.cobfuscator.ast;

import java.util.List;
import java.util.Objects;

/**
 * An element of an {@link InitializerList} preceded by designators, e.g. {@code .x = 1} or {@code [2].y = 3}.
 */
public record DesignatedInitializer(List<Designator> designators, Initializer value) implements Initializer {

    public DesignatedInitializer {
        designators = List.copyOf(designators);
        if (designators.isEmpty())
            throw new IllegalArgumentException("At least one designator is required");
        Objects.requireNonNull(value);
    }
}
