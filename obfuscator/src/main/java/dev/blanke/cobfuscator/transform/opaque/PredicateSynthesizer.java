package dev.blanke.cobfuscator.transform.opaque;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.expression.TypeResolver;
import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.analysis.scope.NameSpace;
import dev.blanke.cobfuscator.analysis.scope.ProgramPoint;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.Trees;

/**
 * Chooses the variables of opaque predicates at a point of the original tree according to the configured styles, and
 * declares the entropic variables needed by the function being transformed.
 */
final class PredicateSynthesizer {

    private static final Logger LOGGER = System.getLogger(PredicateSynthesizer.class.getName());

    /**
     * The probability of declaring a new entropic variable although an existing one could be used.
     */
    private static final double NEW_ENTROPIC_VARIABLE_PROBABILITY = 0.25;

    private static final TruePredicate[] FORMS = TruePredicate.values();

    private final ScopeModel scopes;

    private final TypeResolver types;

    private final NameAllocator names;

    private final Random random;

    private final List<PredicateStyle> styles;

    private final List<String> entropicVariables = new ArrayList<>();

    private final List<BlockItem> entropicDeclarations = new ArrayList<>();

    PredicateSynthesizer(final ScopeModel scopes,
                         final TypeResolver types,
                         final NameAllocator names,
                         final Random random,
                         final Set<PredicateStyle> styles) {
        this.scopes = scopes;
        this.types  = types;
        this.names  = names;
        this.random = random;
        this.styles = styles.stream().sorted().toList();
    }

    /**
     * @return A predicate true at runtime, or {@code null} if the styles provide no variables at the point.
     */
    @Nullable Expression alwaysTrue(final ProgramPoint point) {
        final var form = FORMS[random.nextInt(FORMS.length)];
        final var variables = variables(point, form.getArity());
        return (variables == null) ? null : OpaquePredicates.alwaysTrue(form, variables);
    }

    /**
     * @return A predicate false at runtime, or {@code null} if the styles provide no variables at the point.
     */
    @Nullable Expression alwaysFalse(final ProgramPoint point) {
        final var predicate = alwaysTrue(point);
        return (predicate == null) ? null : OpaquePredicates.negate(predicate);
    }

    /**
     * @return A predicate of unknown value, or {@code null} if the styles provide no variables at the point.
     */
    @Nullable Expression either(final ProgramPoint point) {
        final var variables = variables(point, 1 + random.nextInt(2));
        return (variables == null) ? null : OpaquePredicates.either(random, variables);
    }

    /**
     * Returns the declarations of the entropic variables introduced since the last call, to be placed at the start of
     * the function they were introduced for.
     */
    List<BlockItem> takeEntropicDeclarations() {
        final var declarations = List.copyOf(entropicDeclarations);
        entropicDeclarations.clear();
        entropicVariables.clear();
        return declarations;
    }

    private @Nullable List<String> variables(final ProgramPoint point, final int count) {
        final var inputs = inputsAt(point);
        final var chosen = new ArrayList<String>(count);
        while (chosen.size() < count) {
            final var remaining = new ArrayList<>(styles);
            String variable = null;
            while (variable == null && !remaining.isEmpty()) {
                final var style = remaining.remove(random.nextInt(remaining.size()));
                variable = switch (style) {
                    case DYNAMIC_INPUT -> unused(inputs, chosen);
                    case ENTROPIC      -> entropicVariable(chosen);
                };
            }
            if (variable == null) {
                LOGGER.log(Level.DEBUG, "No variables for an opaque predicate at {0}", point);
                return null;
            }
            chosen.add(variable);
        }
        return chosen;
    }

    private @Nullable String unused(final List<String> candidates, final List<String> chosen) {
        final var available = new ArrayList<>(candidates);
        available.removeAll(chosen);
        return available.isEmpty() ? null : available.get(random.nextInt(available.size()));
    }

    private String entropicVariable(final List<String> chosen) {
        final var existing = unused(entropicVariables, chosen);
        if (existing != null && random.nextDouble() >= NEW_ENTROPIC_VARIABLE_PROBABILITY)
            return existing;

        final var name = names.allocate("entropy");
        entropicVariables.add(name);
        entropicDeclarations.add(new Declaration(name, PrimitiveType.of(Primitive.INT),
            Trees.integer(random.nextInt(Integer.MAX_VALUE))));
        return name;
    }

    /**
     * Collects the integer parameters and local variables holding a determinate value at the passed point.
     */
    private List<String> inputsAt(final ProgramPoint point) {
        final var inputs = new ArrayList<String>();
        for (final var binding : scopes.visibleAt(point, NameSpace.ORDINARY)) {
            final var type = binding.getType();
            if (binding.isAutomatic() && binding.isInitializedAt(point)
                    && type != null && types.isInteger(type)
                    && !Trees.isQualified(types.resolve(type), Qualifier.VOLATILE))
                inputs.add(binding.getName());
        }
        return inputs;
    }
}
