package dev.blanke.cobfuscator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered list of {@link ObfuscationUnit}s a {@link Pipeline} applies one after another.
 */
public final class Composition {

    private final List<ObfuscationUnit> units = new ArrayList<>();

    public Composition() {
    }

    public Composition(final List<ObfuscationUnit> units) {
        units.forEach(this::add);
    }

    /**
     * Creates a composition of enabled units with the passed parameters.
     */
    public static Composition of(final UnitParameters... parameters) {
        final var composition = new Composition();
        for (final var unitParameters : parameters)
            composition.add(new ObfuscationUnit(unitParameters));
        return composition;
    }

    public void add(final ObfuscationUnit unit) {
        units.add(Objects.requireNonNull(unit));
    }

    public void add(final int index, final ObfuscationUnit unit) {
        units.add(index, Objects.requireNonNull(unit));
    }

    public ObfuscationUnit remove(final int index) {
        return units.remove(index);
    }

    public ObfuscationUnit get(final int index) {
        return units.get(index);
    }

    public int size() {
        return units.size();
    }

    public List<ObfuscationUnit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    /**
     * Checks the parameters of every unit, disabled ones included, so that enabling a unit later cannot make an
     * accepted composition invalid.
     *
     * @throws InvalidCompositionException Naming the index of the first unit with invalid parameters.
     */
    public void validate() throws InvalidCompositionException {
        for (int index = 0; index < units.size(); ++index) {
            try {
                units.get(index).getParameters().validate();
            } catch (final InvalidCompositionException exception) {
                throw new InvalidCompositionException("Unit " + index + ": " + exception.getMessage(), exception);
            }
        }
    }

    @Override
    public String toString() {
        return units.toString();
    }
}
