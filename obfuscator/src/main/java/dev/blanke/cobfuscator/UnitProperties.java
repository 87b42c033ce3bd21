package dev.blanke.cobfuscator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reads typed parameter values from the string properties describing a unit and formats them back.
 * <p>
 * Sets of enumeration constants are written as their comma-separated names in declaration order.
 */
final class UnitProperties {

    private final TransformKind kind;

    private final Map<String, String> properties;

    private final Set<String> read = new HashSet<>();

    UnitProperties(final TransformKind kind, final Map<String, String> properties) {
        this.kind       = kind;
        this.properties = properties;
    }

    //region Reading
    private String string(final String key) throws InvalidCompositionException {
        final var value = properties.get(key);
        if (value == null)
            throw new InvalidCompositionException("Missing parameter '" + key + "' of " + kind.getDisplayName());
        read.add(key);
        return value.strip();
    }

    boolean bool(final String key) throws InvalidCompositionException {
        final var value = string(key);
        if (value.equals("true") || value.equals("false"))
            return Boolean.parseBoolean(value);
        throw malformed(key, value, null);
    }

    int integer(final String key) throws InvalidCompositionException {
        final var value = string(key);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException exception) {
            throw malformed(key, value, exception);
        }
    }

    double decimal(final String key) throws InvalidCompositionException {
        final var value = string(key);
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException exception) {
            throw malformed(key, value, exception);
        }
    }

    <E extends Enum<E>> E constant(final String key, final Class<E> type) throws InvalidCompositionException {
        final var value = string(key);
        try {
            return Enum.valueOf(type, value);
        } catch (final IllegalArgumentException exception) {
            throw malformed(key, value, exception);
        }
    }

    <E extends Enum<E>> Set<E> constants(final String key, final Class<E> type) throws InvalidCompositionException {
        final var value = string(key);
        final var constants = EnumSet.noneOf(type);
        if (value.isEmpty())
            return constants;
        for (final var name : value.split(",")) {
            try {
                constants.add(Enum.valueOf(type, name.strip()));
            } catch (final IllegalArgumentException exception) {
                throw malformed(key, value, exception);
            }
        }
        return constants;
    }

    /**
     * @throws InvalidCompositionException If a property was passed that none of the calls so far has read.
     */
    void requireAllRead() throws InvalidCompositionException {
        final var unknown = new TreeSet<>(properties.keySet());
        unknown.removeAll(read);
        if (!unknown.isEmpty())
            throw new InvalidCompositionException("Unknown parameter(s) " + unknown + " of " + kind.getDisplayName());
    }

    private InvalidCompositionException malformed(final String key, final String value, final Throwable cause) {
        final var message = "Malformed value '" + value + "' of parameter '" + key + "' of " + kind.getDisplayName();
        return (cause == null)
            ? new InvalidCompositionException(message)
            : new InvalidCompositionException(message, cause);
    }
    //endregion

    //region Writing
    static String format(final Set<? extends Enum<?>> constants) {
        final var sorted = new ArrayList<Enum<?>>(constants);
        sorted.sort((first, second) -> Integer.compare(first.ordinal(), second.ordinal()));
        return sorted.stream().map(Enum::name).collect(Collectors.joining(","));
    }
    //endregion

    //region Validation
    static void requireProbability(final TransformKind kind, final String key, final double value)
            throws InvalidCompositionException {
        if (!(value >= 0 && value <= 1))
            throw new InvalidCompositionException(kind.getDisplayName() + " parameter '" + key
                + "' must lie in [0, 1], but is " + value);
    }

    static void requireNonNegative(final TransformKind kind, final String key, final int value)
            throws InvalidCompositionException {
        if (value < 0)
            throw new InvalidCompositionException(kind.getDisplayName() + " parameter '" + key
                + "' must not be negative, but is " + value);
    }

    static void requireNonEmpty(final TransformKind kind, final String key, final Set<?> value)
            throws InvalidCompositionException {
        if (value.isEmpty())
            throw new InvalidCompositionException(kind.getDisplayName() + " parameter '" + key
                + "' must name at least one option");
    }
    //endregion
}
