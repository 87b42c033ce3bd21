package dev.blanke.cobfuscator.analysis.expression;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.ArrayType;
import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CastExpression;
import dev.blanke.cobfuscator.ast.CharacterConstant;
import dev.blanke.cobfuscator.ast.ConditionalExpression;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.PointerType;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.QualifiedType;
import dev.blanke.cobfuscator.ast.SizeofTypeExpression;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.TypedefName;
import dev.blanke.cobfuscator.ast.UnaryExpression;

/**
 * Maps types as written in the source to the types they denote, by expanding typedef names and replacing references
 * to structures and unions with their definitions.
 * <p>
 * Only the top level of a type is resolved; the target of a pointer, for instance, is resolved once it is needed.
 */
public final class TypeResolver {

    private final ScopeModel model;

    public TypeResolver(final ScopeModel model) {
        this.model = Objects.requireNonNull(model);
    }

    public CType resolve(final CType type) {
        if (type instanceof TypedefName typedefName) {
            final var binding = model.bindingOf(typedefName);
            return (binding == null || binding.getType() == null) ? type : resolve(binding.getType());
        }
        if (type instanceof StructType struct && !struct.isDefinition()) {
            final var binding = model.bindingOf(struct);
            return (binding != null && binding.getDeclaration() instanceof StructType definition
                    && definition.isDefinition()) ? definition : type;
        }
        if (type instanceof QualifiedType qualified) {
            final var inner = resolve(qualified.type());
            return (inner == qualified.type()) ? type : new QualifiedType(qualified.qualifiers(), inner);
        }
        return type;
    }

    /**
     * Resolves the type and removes its top-level qualifiers, yielding the type of a value read from an object of the
     * passed type.
     */
    public CType resolveUnqualified(final CType type) {
        return Trees.unqualified(resolve(type));
    }

    /**
     * Returns the arithmetic type denoted by the passed type. Enumerated types yield {@code null}, as the integer type
     * compatible with them is chosen by the compiler.
     */
    public @Nullable Primitive arithmetic(final CType type) {
        return (resolveUnqualified(type) instanceof PrimitiveType primitive && primitive.primitive().isArithmetic())
            ? primitive.primitive() : null;
    }

    public boolean isInteger(final CType type) {
        final var arithmetic = arithmetic(type);
        return arithmetic != null && arithmetic.isInteger();
    }

    /**
     * Returns the type an operand of the passed type has after array-to-pointer and function-to-pointer conversion.
     */
    public CType decay(final CType type) {
        final var resolved = resolveUnqualified(type);
        if (resolved instanceof ArrayType array)
            return new PointerType(array.element());
        if (resolved instanceof FunctionType)
            return new PointerType(resolved);
        return resolved;
    }

    /**
     * @return The type pointed to after decay, or {@code null} if the type is not a pointer or array type.
     */
    public @Nullable CType pointee(final CType type) {
        return (decay(type) instanceof PointerType pointer) ? resolveUnqualified(pointer.target()) : null;
    }

    public boolean isVariablyModified(final CType type) {
        final var resolved = resolveUnqualified(type);
        if (resolved instanceof ArrayType array)
            return (array.size() != null && !isIntegerConstantExpression(array.size()))
                || isVariablyModified(array.element());
        if (resolved instanceof PointerType pointer)
            return isVariablyModified(pointer.target());
        return false;
    }

    /**
     * Decides whether the passed expression is an integer constant expression, which the compiler evaluates during
     * translation. Enumeration constants qualify, variables never do.
     */
    public boolean isIntegerConstantExpression(final Expression expression) {
        if (expression instanceof IntegerConstant || expression instanceof CharacterConstant
                || expression instanceof SizeofTypeExpression)
            return true;
        if (expression instanceof Identifier identifier) {
            final var binding = model.bindingOf(identifier);
            return binding != null && binding.getKind() == BindingKind.ENUMERATOR;
        }
        if (expression instanceof UnaryExpression unary)
            return switch (unary.operator()) {
                case PLUS, NEGATE, BITWISE_NOT, LOGICAL_NOT -> isIntegerConstantExpression(unary.operand());
                case SIZEOF -> true;
                default     -> false;
            };
        if (expression instanceof BinaryExpression binary)
            return isIntegerConstantExpression(binary.left()) && isIntegerConstantExpression(binary.right());
        if (expression instanceof ConditionalExpression conditional)
            return isIntegerConstantExpression(conditional.condition())
                && isIntegerConstantExpression(conditional.whenTrue())
                && isIntegerConstantExpression(conditional.whenFalse());
        if (expression instanceof CastExpression cast)
            return isInteger(cast.type()) && isIntegerConstantExpression(cast.operand());
        return false;
    }
}
