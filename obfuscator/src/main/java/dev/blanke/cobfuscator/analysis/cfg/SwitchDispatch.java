package dev.blanke.cobfuscator.analysis.cfg;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

import dev.blanke.cobfuscator.ast.Expression;

/**
 * The dispatch of a {@code switch} statement to the blocks starting at its {@code case} labels.
 *
 * @param defaultTarget The block starting at the {@code default} label, or the block following the {@code switch}
 *                      statement if there is none.
 */
public record SwitchDispatch(Expression selector, List<Case> cases, int defaultTarget) implements Terminator {

    public record Case(Expression value, int target) {

        public Case {
            Objects.requireNonNull(value);
        }
    }

    public SwitchDispatch {
        Objects.requireNonNull(selector);
        cases = List.copyOf(cases);
    }

    @Override
    public List<Integer> successors() {
        final var successors = new ArrayList<Integer>(cases.size() + 1);
        for (final var switchCase : cases)
            successors.add(switchCase.target());
        successors.add(defaultTarget);
        return successors;
    }

    @Override
    public SwitchDispatch remap(final IntUnaryOperator ids) {
        final var remapped = new ArrayList<Case>(cases.size());
        for (final var switchCase : cases)
            remapped.add(new Case(switchCase.value(), ids.applyAsInt(switchCase.target())));
        return new SwitchDispatch(selector, remapped, ids.applyAsInt(defaultTarget));
    }
}
