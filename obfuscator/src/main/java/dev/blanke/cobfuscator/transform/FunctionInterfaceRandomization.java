package dev.blanke.cobfuscator.transform;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.analysis.scope.NameSpace;
import dev.blanke.cobfuscator.ast.CallExpression;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.Parameter;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.Trees;

/**
 * Changes the parameter lists of the functions defined in a translation unit by adding unused parameters and, where
 * possible, shuffling the order of the parameters. The definition, every prototype and every call site of a function
 * are rewritten together.
 * <p>
 * The arguments passed for added parameters are random constants or, if the original arguments of a call are free of
 * side effects, variables visible at the call site.
 * <p>
 * {@code main} and variadic functions keep their interface. The parameters of a function are not reordered if any of
 * its calls passes more than one argument with effects, since reordering could change the order in which those effects
 * take place.
 */
public final class FunctionInterfaceRandomization implements Transform {

    private static final Logger LOGGER = System.getLogger(FunctionInterfaceRandomization.class.getName());

    private static final List<Primitive> EXTRA_PARAMETER_TYPES =
        List.of(Primitive.INT, Primitive.UNSIGNED_INT, Primitive.LONG);

    private final int extraParameters;

    private final double variableProbability;

    private final boolean randomiseOrder;

    public FunctionInterfaceRandomization(final int     extraParameters,
                                          final double  variableProbability,
                                          final boolean randomiseOrder) {
        this.extraParameters     = extraParameters;
        this.variableProbability = variableProbability;
        this.randomiseOrder      = randomiseOrder;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return new InterfaceRandomizingTransformer(unit, random).transform();
    }

    /**
     * The new interface of a function.
     *
     * @param slots For each new parameter position, the index of the original parameter placed there, or {@code -1}
     *              for an added parameter.
     *
     * @param extras The added parameters, in the order of their positions.
     */
    private record Interface(List<Integer> slots, List<Parameter> extras) {
    }

    private final class InterfaceRandomizingTransformer extends ObfuscatingTransformer {

        private final Map<Binding, Interface> interfaces = new IdentityHashMap<>();

        private final Set<Identifier> callees = Collections.newSetFromMap(new IdentityHashMap<>());

        private final Map<Binding, List<CallExpression>> calls = new IdentityHashMap<>();

        InterfaceRandomizingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
            collectCalls();
            planInterfaces();
        }

        private void collectCalls() {
            new TreeVisitor() {

                @Override
                public void visitCallExpression(final CallExpression expression) {
                    if (expression.callee() instanceof Identifier identifier) {
                        final var binding = scopes.bindingOf(identifier);
                        if (binding != null && binding.getKind() == BindingKind.FUNCTION) {
                            callees.add(identifier);
                            calls.computeIfAbsent(binding, key -> new ArrayList<>()).add(expression);
                        }
                    }
                    super.visitCallExpression(expression);
                }
            }.visitSourceUnit(unit);
        }

        private void planInterfaces() {
            final var names = new NameAllocator(scopes);
            final var definitions = new LinkedHashMap<Binding, FunctionDefinition>();
            for (final var declaration : unit.declarations())
                if (declaration instanceof FunctionDefinition function && !function.name().equals("main")
                        && !function.type().variadic())
                    definitions.put(scopes.bindingOf(function), function);

            for (final var entry : definitions.entrySet()) {
                final var binding  = entry.getKey();
                final var function = entry.getValue();
                checkEscape(binding);

                final var parameterCount = function.type().parameters().size();
                for (final var call : calls.getOrDefault(binding, List.of()))
                    if (call.arguments().size() != parameterCount)
                        throw new PreconditionViolationException("Call of '" + function.name() + "' passes "
                            + call.arguments().size() + " arguments for " + parameterCount + " parameters");

                final var slots = new ArrayList<Integer>();
                for (int i = 0; i < parameterCount; i++)
                    slots.add(i);
                if (randomiseOrder && isReorderable(binding))
                    Collections.shuffle(slots, random);
                for (int i = 0; i < extraParameters; i++)
                    slots.add(random.nextInt(slots.size() + 1), -1);

                final var extras = new ArrayList<Parameter>();
                for (int i = 0; i < extraParameters; i++)
                    extras.add(new Parameter(names.allocate("arg"),
                        PrimitiveType.of(EXTRA_PARAMETER_TYPES.get(random.nextInt(EXTRA_PARAMETER_TYPES.size())))));
                interfaces.put(binding, new Interface(slots, extras));
                LOGGER.log(Level.DEBUG, "New parameter order of ''{0}'': {1}", function.name(), slots);
            }
        }

        /**
         * Ensures that the function is only ever called directly, as calls through pointers cannot be rewritten.
         */
        private void checkEscape(final Binding function) {
            for (final var occurrence : function.getOccurrences())
                if (occurrence.node() instanceof Identifier identifier && !callees.contains(identifier))
                    throw new PreconditionViolationException("Address of function '" + function.getName()
                        + "' escapes");
        }

        private boolean isReorderable(final Binding function) {
            for (final var call : calls.getOrDefault(function, List.of())) {
                int effectful = 0;
                for (final var argument : call.arguments()) {
                    final var info = infoOf(argument);
                    if (info == null || !info.effect().isPure())
                        effectful++;
                }
                if (effectful > 1)
                    return false;
            }
            return true;
        }

        private <T> List<T> arrange(final Interface newInterface, final List<T> originals, final List<T> extras) {
            final var arranged = new ArrayList<T>(newInterface.slots().size());
            int extra = 0;
            for (final var slot : newInterface.slots())
                arranged.add((slot < 0) ? extras.get(extra++) : originals.get(slot));
            return arranged;
        }

        private FunctionType rewrite(final FunctionType type, final Interface newInterface,
                                     final FunctionType definitionType, final boolean named) {
            var originals = type.parameters();
            if (originals.size() != definitionType.parameters().size()) {
                originals = new ArrayList<>();
                for (final var parameter : definitionType.parameters())
                    originals.add(new Parameter(null, Trees.copy(parameter.type())));
            }
            final var extras = new ArrayList<Parameter>();
            for (final var parameter : newInterface.extras())
                extras.add(new Parameter(named ? parameter.name() : null, Trees.copy(parameter.type())));
            return new FunctionType(type.returnType(), arrange(newInterface, originals, extras), false, true);
        }

        private @Nullable FunctionDefinition definitionOf(final Binding binding) {
            return (binding.getDeclaration() instanceof FunctionDefinition definition) ? definition : null;
        }

        @Override
        public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
            final var transformed = super.transformFunctionDefinition(function);
            final var newInterface = interfaces.get(scopes.bindingOf(function));
            if (newInterface == null)
                return transformed;
            return new FunctionDefinition(transformed.name(),
                rewrite(transformed.type(), newInterface, function.type(), true), transformed.storage(),
                transformed.body());
        }

        @Override
        public Declaration transformDeclaration(final Declaration declaration) {
            final var transformed = super.transformDeclaration(declaration);
            final var binding = scopes.bindingOf(declaration);
            final var newInterface = (binding == null) ? null : interfaces.get(binding);
            if (newInterface == null)
                return transformed;
            if (!(transformed.type() instanceof FunctionType type))
                throw new PreconditionViolationException("Cannot rewrite declaration of '" + declaration.name()
                    + "' declared through a typedef");
            return new Declaration(transformed.name(),
                rewrite(type, newInterface, definitionOf(binding).type(), false), transformed.storage(),
                transformed.initializer());
        }

        @Override
        public Expression transformCallExpression(final CallExpression expression) {
            final var transformed = (CallExpression) super.transformCallExpression(expression);
            final var binding = (expression.callee() instanceof Identifier identifier)
                ? scopes.bindingOf(identifier) : null;
            final var newInterface = (binding == null) ? null : interfaces.get(binding);
            if (newInterface == null)
                return transformed;

            final var variablesAllowed = expression.arguments().stream().allMatch(argument -> {
                final var info = infoOf(argument);
                return info != null && info.effect().isSideEffectFree();
            });
            final var extras = new ArrayList<Expression>();
            for (final var parameter : newInterface.extras())
                extras.add(extraArgument(expression, ((PrimitiveType) parameter.type()).primitive(),
                    variablesAllowed));
            return new CallExpression(transformed.callee(),
                arrange(newInterface, transformed.arguments(), extras));
        }

        private Expression extraArgument(final CallExpression call, final Primitive type,
                                         final boolean variablesAllowed) {
            if (variablesAllowed && random.nextDouble() < variableProbability) {
                final var candidates = new ArrayList<Binding>();
                final var point = scopes.pointOf(call);
                for (final var binding : scopes.visibleAt(point, NameSpace.ORDINARY))
                    if (binding.getKind() == BindingKind.VARIABLE && binding.isInitializedAt(point)
                            && binding.getType() != null
                            && !Trees.isQualified(expressions.getTypes().resolve(binding.getType()), Qualifier.VOLATILE)
                            && expressions.getTypes().arithmetic(binding.getType()) == type)
                        candidates.add(binding);
                if (!candidates.isEmpty())
                    return Trees.identifier(candidates.get(random.nextInt(candidates.size())).getName());
            }
            final var value = random.nextInt(1 << 16);
            return (type == Primitive.UNSIGNED_INT) ? Trees.unsigned(value) : Trees.integer(value);
        }
    }
}
