package dev.blanke.cobfuscator.analysis.expression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.AnalysisException;
import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.ArrayType;
import dev.blanke.cobfuscator.ast.AssignmentExpression;
import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CallExpression;
import dev.blanke.cobfuscator.ast.CastExpression;
import dev.blanke.cobfuscator.ast.CharacterConstant;
import dev.blanke.cobfuscator.ast.CommaExpression;
import dev.blanke.cobfuscator.ast.CompoundLiteral;
import dev.blanke.cobfuscator.ast.ConditionalExpression;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.DesignatedInitializer;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FloatingConstant;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.Initializer;
import dev.blanke.cobfuscator.ast.InitializerList;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.MemberDesignator;
import dev.blanke.cobfuscator.ast.MemberExpression;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.PointerType;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.SizeofTypeExpression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.StringLiteral;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.SubscriptExpression;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.UnaryExpression;

import static dev.blanke.cobfuscator.analysis.expression.ArithmeticConversions.promote;
import static dev.blanke.cobfuscator.analysis.expression.ArithmeticConversions.usualArithmeticConversion;

/**
 * Infers the type and the {@link Effect} of every expression of a translation unit.
 * <p>
 * Expressions are analyzed bottom-up: the traversal visits the operands of an expression before the information about
 * the expression itself is derived from theirs. Member accesses and member designators are resolved along the way,
 * since finding the member requires the type of the accessed aggregate.
 */
public final class ExpressionAnalyzer extends TreeVisitor {

    private static final Logger LOGGER = System.getLogger(ExpressionAnalyzer.class.getName());

    private static final CType INT = PrimitiveType.of(Primitive.INT);

    private static final CType SIZE_T = PrimitiveType.of(Primitive.UNSIGNED_LONG);

    private final ScopeModel model;

    private final TypeResolver types;

    private final Set<String> pureFunctions;

    private final Map<Expression, ExpressionInfo> infos = new IdentityHashMap<>();

    private final Map<Node, Binding> memberBindings = new IdentityHashMap<>();

    private final Set<String> unresolvedMemberNames = new TreeSet<>();

    private ExpressionAnalyzer(final ScopeModel model, final Set<String> pureFunctions) {
        this.model         = model;
        this.types         = new TypeResolver(model);
        this.pureFunctions = pureFunctions;
    }

    public static ExpressionAnalysis analyze(final SourceUnit unit, final ScopeModel model) {
        final var pureFunctions = PurityAnalysis.pureFunctions(unit, model);
        final var analyzer = new ExpressionAnalyzer(model, pureFunctions);
        analyzer.visitSourceUnit(unit);

        LOGGER.log(Level.DEBUG, "Analyzed {0} expressions, pure functions: {1}", analyzer.infos.size(),
            pureFunctions);
        return new ExpressionAnalysis(model, analyzer.types, analyzer.infos, analyzer.memberBindings,
            analyzer.unresolvedMemberNames, pureFunctions);
    }

    private ExpressionInfo info(final Expression expression) {
        final var info = infos.get(expression);
        if (info == null)
            throw new AnalysisException("Operand has not been analyzed: " + expression);
        return info;
    }

    //region Initializers
    @Override
    public void visitDeclaration(final Declaration declaration) {
        super.visitDeclaration(declaration);
        if (declaration.initializer() instanceof InitializerList list)
            bindDesignators(declaration.type(), list);
    }

    @Override
    public void visitCompoundLiteral(final CompoundLiteral literal) {
        super.visitCompoundLiteral(literal);
        bindDesignators(literal.type(), literal.initializer());
    }

    /**
     * Resolves the member designators within an initializer list for an object of the passed type. Nested lists
     * initialize the subobject selected by their designators or, lacking designators, by their position.
     */
    private void bindDesignators(final @Nullable CType type, final InitializerList list) {
        final var resolved = (type == null) ? null : types.resolveUnqualified(type);
        int position = 0;
        for (final var item : list.items()) {
            Initializer value = item;
            CType subobject;
            if (item instanceof DesignatedInitializer designated) {
                subobject = resolved;
                for (final var designator : designated.designators()) {
                    if (designator instanceof MemberDesignator member) {
                        final var binding = (subobject == null) ? null : member(subobject, member.name());
                        if (binding == null) {
                            unresolvedMemberNames.add(member.name());
                            subobject = null;
                            continue;
                        }
                        memberBindings.put(member, binding);
                        if (subobject == resolved)
                            position = memberIndex((StructType) resolved, member.name()) + 1;
                        subobject = (binding.getType() == null) ? null : types.resolveUnqualified(binding.getType());
                    } else
                        subobject = (subobject instanceof ArrayType array)
                            ? types.resolveUnqualified(array.element()) : null;
                }
                value = designated.value();
            } else
                subobject = subobjectAt(resolved, position++);

            if (value instanceof InitializerList nested) {
                if (subobject instanceof StructType || subobject instanceof ArrayType)
                    bindDesignators(subobject, nested);
                else
                    markUnresolved(nested);
            }
        }
    }

    private @Nullable CType subobjectAt(final @Nullable CType aggregate, final int position) {
        if (aggregate instanceof ArrayType array)
            return types.resolveUnqualified(array.element());
        if (aggregate instanceof StructType struct && struct.isDefinition() && position < struct.members().size()) {
            final var member = struct.members().get(struct.union() ? 0 : position);
            return types.resolveUnqualified(member.type());
        }
        return null;
    }

    private static int memberIndex(final StructType struct, final String name) {
        final List<Declaration> members = struct.members();
        for (int i = 0; i < members.size(); i++)
            if (members.get(i).name().equals(name))
                return i;
        return -1;
    }

    private void markUnresolved(final Initializer initializer) {
        if (initializer instanceof InitializerList list)
            list.items().forEach(this::markUnresolved);
        else if (initializer instanceof DesignatedInitializer designated) {
            for (final var designator : designated.designators())
                if (designator instanceof MemberDesignator member)
                    unresolvedMemberNames.add(member.name());
            markUnresolved(designated.value());
        }
    }

    private Effect initializerEffect(final Initializer initializer) {
        if (initializer instanceof Expression expression)
            return info(expression).effect();
        if (initializer instanceof DesignatedInitializer designated)
            return initializerEffect(designated.value());
        var effect = Effect.PURE;
        for (final var item : ((InitializerList) initializer).items())
            effect = effect.combine(initializerEffect(item));
        return effect;
    }
    //endregion

    //region Members
    private @Nullable Binding member(final CType aggregate, final String name) {
        return (types.resolveUnqualified(aggregate) instanceof StructType struct && struct.isDefinition())
            ? model.member(struct, name) : null;
    }
    //endregion

    //region Expressions
    @Override
    public void visitExpression(final Expression expression) {
        super.visitExpression(expression);
        infos.put(expression, infer(expression));
    }

    private ExpressionInfo infer(final Expression expression) {
        if (expression instanceof Identifier identifier)
            return inferIdentifier(identifier);
        if (expression instanceof IntegerConstant constant)
            return new ExpressionInfo(PrimitiveType.of(typeOf(constant)), Effect.PURE);
        if (expression instanceof FloatingConstant constant)
            return new ExpressionInfo(PrimitiveType.of(typeOf(constant)), Effect.PURE);
        if (expression instanceof CharacterConstant)
            return new ExpressionInfo(INT, Effect.PURE);
        if (expression instanceof StringLiteral)
            return new ExpressionInfo(new ArrayType(PrimitiveType.of(Primitive.CHAR), null), Effect.PURE);
        if (expression instanceof UnaryExpression unary)
            return inferUnary(unary);
        if (expression instanceof SizeofTypeExpression)
            return new ExpressionInfo(SIZE_T, Effect.PURE);
        if (expression instanceof BinaryExpression binary)
            return inferBinary(binary);
        if (expression instanceof AssignmentExpression assignment)
            return new ExpressionInfo(info(assignment.target()).type(), info(assignment.target()).effect()
                .combine(info(assignment.value()).effect()).combine(Effect.HAS_SIDE_EFFECT));
        if (expression instanceof ConditionalExpression conditional)
            return inferConditional(conditional);
        if (expression instanceof CallExpression call)
            return inferCall(call);
        if (expression instanceof SubscriptExpression subscript)
            return inferSubscript(subscript);
        if (expression instanceof MemberExpression member)
            return inferMember(member);
        if (expression instanceof CastExpression cast)
            return new ExpressionInfo(types.resolveUnqualified(cast.type()), info(cast.operand()).effect());
        if (expression instanceof CommaExpression comma) {
            var effect = Effect.PURE;
            for (final var operand : comma.expressions())
                effect = effect.combine(info(operand).effect());
            return new ExpressionInfo(info(comma.expressions().get(comma.expressions().size() - 1)).type(), effect);
        }
        if (expression instanceof CompoundLiteral literal)
            return new ExpressionInfo(types.resolveUnqualified(literal.type()),
                initializerEffect(literal.initializer()));
        throw new AnalysisException("Cannot analyze expression " + expression);
    }

    private ExpressionInfo inferIdentifier(final Identifier identifier) {
        final var binding = model.bindingOf(identifier);
        if (binding == null)
            return new ExpressionInfo(null, Effect.UNKNOWN);
        return switch (binding.getKind()) {
            case ENUMERATOR -> new ExpressionInfo(INT, Effect.PURE);
            case FUNCTION, VARIABLE -> {
                final var type = binding.getType();
                final Effect effect;
                if (type != null && isVolatile(type))
                    effect = Effect.HAS_SIDE_EFFECT;
                else if (binding.hasStaticStorage())
                    effect = Effect.READS_GLOBAL;
                else
                    effect = Effect.PURE;
                yield new ExpressionInfo((type == null) ? null : types.resolveUnqualified(type), effect);
            }
            case TYPEDEF, TAG, MEMBER, LABEL ->
                throw new AnalysisException("Identifier '" + identifier.name() + "' resolves to " + binding);
        };
    }

    private ExpressionInfo inferUnary(final UnaryExpression expression) {
        final var operand = info(expression.operand());
        final var arithmetic = operand.arithmeticType();
        return switch (expression.operator()) {
            case PLUS, NEGATE, BITWISE_NOT ->
                new ExpressionInfo((arithmetic == null) ? null : PrimitiveType.of(promote(arithmetic)),
                    operand.effect());
            case LOGICAL_NOT -> new ExpressionInfo(INT, operand.effect());
            case ADDRESS_OF  ->
                new ExpressionInfo((operand.type() == null) ? null : new PointerType(operand.type()),
                    operand.effect());
            case DEREFERENCE -> dereference(operand.type(), operand.effect());
            case PRE_INCREMENT, PRE_DECREMENT, POST_INCREMENT, POST_DECREMENT ->
                new ExpressionInfo(operand.type(), operand.effect().combine(Effect.HAS_SIDE_EFFECT));
            case SIZEOF -> new ExpressionInfo(SIZE_T,
                (operand.type() != null && types.isVariablyModified(operand.type()))
                    ? operand.effect() : Effect.PURE);
        };
    }

    /**
     * Derives the information about an access to the object the passed pointer or array points to.
     */
    private ExpressionInfo dereference(final @Nullable CType pointer, final Effect effect) {
        if (pointer == null || !(types.decay(pointer) instanceof PointerType decayed))
            return new ExpressionInfo(null, effect.combine(Effect.READS_GLOBAL));
        final var target = decayed.target();
        return new ExpressionInfo(types.resolveUnqualified(target),
            effect.combine(isVolatile(target) ? Effect.HAS_SIDE_EFFECT : Effect.READS_GLOBAL));
    }

    private ExpressionInfo inferBinary(final BinaryExpression expression) {
        final var left   = info(expression.left());
        final var right  = info(expression.right());
        final var effect = left.effect().combine(right.effect());
        final var operator = expression.operator();

        if (operator.isComparison() || operator.isLogical())
            return new ExpressionInfo(INT, effect);
        if (operator.isShift())
            return new ExpressionInfo(left.isInteger() ? PrimitiveType.of(promote(left.arithmeticType())) : null,
                effect);
        if (left.arithmeticType() != null && right.arithmeticType() != null)
            return new ExpressionInfo(
                PrimitiveType.of(usualArithmeticConversion(left.arithmeticType(), right.arithmeticType())), effect);

        final var leftPointer  = isPointer(left.type());
        final var rightPointer = isPointer(right.type());
        if (operator == BinaryOperator.ADD && leftPointer && right.isInteger())
            return new ExpressionInfo(types.decay(left.type()), effect);
        if (operator == BinaryOperator.ADD && rightPointer && left.isInteger())
            return new ExpressionInfo(types.decay(right.type()), effect);
        if (operator == BinaryOperator.SUBTRACT && leftPointer && rightPointer)
            return new ExpressionInfo(PrimitiveType.of(Primitive.LONG), effect);
        if (operator == BinaryOperator.SUBTRACT && leftPointer && right.isInteger())
            return new ExpressionInfo(types.decay(left.type()), effect);
        return new ExpressionInfo(null, effect);
    }

    private ExpressionInfo inferConditional(final ConditionalExpression expression) {
        final var whenTrue  = info(expression.whenTrue());
        final var whenFalse = info(expression.whenFalse());
        final var effect = info(expression.condition()).effect()
            .combine(whenTrue.effect())
            .combine(whenFalse.effect());
        if (whenTrue.arithmeticType() != null && whenFalse.arithmeticType() != null)
            return new ExpressionInfo(
                PrimitiveType.of(usualArithmeticConversion(whenTrue.arithmeticType(), whenFalse.arithmeticType())),
                effect);
        final var type = (whenTrue.type() != null) ? whenTrue.type() : whenFalse.type();
        return new ExpressionInfo((type == null) ? null : types.decay(type), effect);
    }

    private ExpressionInfo inferCall(final CallExpression call) {
        final var callee = info(call.callee());
        var effect = callee.effect();
        for (final var argument : call.arguments())
            effect = effect.combine(info(argument).effect());

        final var binding = (call.callee() instanceof Identifier identifier) ? model.bindingOf(identifier) : null;
        if (binding == null || binding.getKind() != BindingKind.FUNCTION || !pureFunctions.contains(binding.getName()))
            effect = Effect.UNKNOWN;

        CType returnType = null;
        if (callee.type() != null && types.decay(callee.type()) instanceof PointerType pointer
                && types.resolveUnqualified(pointer.target()) instanceof FunctionType function)
            returnType = types.resolveUnqualified(function.returnType());
        return new ExpressionInfo(returnType, effect);
    }

    private ExpressionInfo inferSubscript(final SubscriptExpression expression) {
        final var array = info(expression.array());
        final var index = info(expression.index());
        final var effect = array.effect().combine(index.effect());
        return dereference(isPointer(array.type()) ? array.type() : index.type(), effect);
    }

    private ExpressionInfo inferMember(final MemberExpression expression) {
        final var base = info(expression.base());
        CType aggregate = base.type();
        if (expression.arrow())
            aggregate = (aggregate != null && types.decay(aggregate) instanceof PointerType pointer)
                ? pointer.target() : null;

        final var binding = (aggregate == null) ? null : member(aggregate, expression.member());
        var effect = base.effect();
        if (expression.arrow())
            effect = effect.combine(Effect.READS_GLOBAL);
        if (binding == null) {
            unresolvedMemberNames.add(expression.member());
            return new ExpressionInfo(null, effect);
        }
        memberBindings.put(expression, binding);

        final var type = binding.getType();
        if (type != null && isVolatile(type))
            effect = effect.combine(Effect.HAS_SIDE_EFFECT);
        return new ExpressionInfo((type == null) ? null : types.resolveUnqualified(type), effect);
    }
    //endregion

    private boolean isPointer(final @Nullable CType type) {
        return type != null && types.decay(type) instanceof PointerType;
    }

    private boolean isVolatile(final CType type) {
        return Trees.isQualified(types.resolve(type), Qualifier.VOLATILE);
    }

    /**
     * Determines the type of an integer constant: the first type of the list given by its suffix and notation which
     * can represent its value.
     */
    static Primitive typeOf(final IntegerConstant constant) {
        final var suffix = constant.suffix();
        final var value  = constant.value();
        final var longs  = suffix.chars().filter(character -> character == 'l').count();

        final List<Primitive> candidates;
        if (suffix.contains("u"))
            candidates = List.of(Primitive.UNSIGNED_INT, Primitive.UNSIGNED_LONG, Primitive.UNSIGNED_LONG_LONG);
        else if (constant.isDecimal())
            candidates = List.of(Primitive.INT, Primitive.LONG, Primitive.LONG_LONG);
        else
            candidates = List.of(Primitive.INT, Primitive.UNSIGNED_INT, Primitive.LONG, Primitive.UNSIGNED_LONG,
                Primitive.LONG_LONG, Primitive.UNSIGNED_LONG_LONG);

        for (final var candidate : candidates) {
            if (longs >= 1 && candidate.getRank() < Primitive.LONG.getRank()
                    || longs >= 2 && candidate.getRank() < Primitive.LONG_LONG.getRank())
                continue;
            if (fits(candidate, value))
                return candidate;
        }
        return Primitive.UNSIGNED_LONG_LONG;
    }

    private static boolean fits(final Primitive type, final long value) {
        if (type.getSize() == 8)
            return !type.isSigned() || value >= 0;
        return value >= 0 && value <= (type.isSigned() ? Integer.MAX_VALUE : 0xFFFF_FFFFL);
    }

    static Primitive typeOf(final FloatingConstant constant) {
        final var last = Character.toLowerCase(constant.text().charAt(constant.text().length() - 1));
        if (last == 'f')
            return Primitive.FLOAT;
        return (last == 'l') ? Primitive.LONG_DOUBLE : Primitive.DOUBLE;
    }
}
