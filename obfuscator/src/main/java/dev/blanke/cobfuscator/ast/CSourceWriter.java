package dev.blanke.cobfuscator.ast;

import java.util.ArrayList;
import java.util.StringJoiner;

/**
 * Serializes syntax trees back into C source code.
 * <p>
 * The output is canonical: two structurally equal trees always yield the same text. Parentheses are only emitted
 * where the precedence of the nested expression requires them.
 */
public final class CSourceWriter {

    private static final String INDENT = "    ";

    //region Precedence levels
    private static final int PRIMARY     = 17;
    private static final int POSTFIX     = 16;
    private static final int UNARY       = 15;
    private static final int CAST        = 14;
    private static final int CONDITIONAL = 3;
    private static final int ASSIGNMENT  = 2;
    private static final int COMMA       = 1;
    //endregion

    private final StringBuilder builder = new StringBuilder();

    private int depth;

    /**
     * Whether the next line continues the current one, e.g. after {@code "} else "}.
     */
    private boolean continuation;

    private CSourceWriter() {
    }

    public static String write(final SourceUnit unit) {
        final var writer = new CSourceWriter();
        for (final var declaration : unit.declarations())
            writer.externalDeclaration(declaration);
        return writer.builder.toString();
    }

    public static String write(final BlockItem item) {
        final var writer = new CSourceWriter();
        writer.blockItem(item);
        return writer.builder.toString();
    }

    public static String write(final Expression expression) {
        return new CSourceWriter().expression(expression, COMMA);
    }

    /**
     * Returns the type name of the passed type as it would appear in a cast, e.g. {@code int (*)[4]}.
     */
    public static String write(final CType type) {
        return new CSourceWriter().typeName(type);
    }

    private void startLine() {
        if (continuation)
            continuation = false;
        else
            builder.append(INDENT.repeat(depth));
    }

    private void line(final String text) {
        startLine();
        builder.append(text).append('\n');
    }

    private void externalDeclaration(final ExternalDeclaration declaration) {
        if (declaration instanceof FunctionDefinition function) {
            startLine();
            builder.append(storagePrefix(function.storage())).append(declaration(function.type(), function.name()));
            builder.append(" {\n");
            depth++;
            for (final var item : function.body().items())
                blockItem(item);
            depth--;
            builder.append("}\n\n");
        } else
            blockItem((BlockItem) declaration);
    }

    private void blockItem(final BlockItem item) {
        if (item instanceof Declaration declaration)
            line(declaration(declaration) + ";");
        else if (item instanceof TypedefDeclaration typedef)
            line("typedef " + declaration(typedef.type(), typedef.name()) + ";");
        else if (item instanceof TagDeclaration tag)
            line(specifier(tag.type()) + ";");
        else
            statement((Statement) item);
    }

    private String declaration(final Declaration declaration) {
        final var text = storagePrefix(declaration.storage()) + declaration(declaration.type(), declaration.name());
        return (declaration.initializer() == null) ? text : text + " = " + initializer(declaration.initializer());
    }

    private static String storagePrefix(final StorageClass storage) {
        return (storage == StorageClass.NONE) ? "" : storage.getKeyword() + " ";
    }

    //region Statements
    /**
     * Writes a header such as {@code while (x)} followed by its body.
     *
     * @return {@code true} if the body was a compound statement whose closing brace has not been followed by a line
     *         break yet.
     */
    private boolean open(final String header, final Statement body) {
        if (body instanceof CompoundStatement compound) {
            startLine();
            builder.append(header).append(header.isEmpty() ? "{\n" : " {\n");
            depth++;
            for (final var item : compound.items())
                blockItem(item);
            depth--;
            builder.append(INDENT.repeat(depth)).append('}');
            return true;
        }
        line(header);
        depth++;
        statement(body);
        depth--;
        return false;
    }

    private void statement(final Statement statement) {
        if (statement instanceof CompoundStatement) {
            open("", statement);
            builder.append('\n');
        } else if (statement instanceof ExpressionStatement expressionStatement) {
            final var expression = expressionStatement.expression();
            line((expression == null) ? ";" : expression(expression, COMMA) + ";");
        } else if (statement instanceof IfStatement ifStatement)
            ifStatement(ifStatement);
        else if (statement instanceof WhileStatement whileStatement) {
            if (open("while (" + expression(whileStatement.condition(), COMMA) + ")", whileStatement.body()))
                builder.append('\n');
        } else if (statement instanceof DoWhileStatement doWhile) {
            final var condition = "while (" + expression(doWhile.condition(), COMMA) + ");";
            if (open("do", doWhile.body()))
                builder.append(' ').append(condition).append('\n');
            else
                line(condition);
        } else if (statement instanceof ForStatement forStatement) {
            if (open(forHeader(forStatement), forStatement.body()))
                builder.append('\n');
        } else if (statement instanceof SwitchStatement switchStatement) {
            if (open("switch (" + expression(switchStatement.selector(), COMMA) + ")", switchStatement.body()))
                builder.append('\n');
        } else if (statement instanceof CaseStatement caseStatement) {
            line("case " + expression(caseStatement.value(), CONDITIONAL) + ":");
            labeledBody(caseStatement.body());
        } else if (statement instanceof DefaultStatement defaultStatement) {
            line("default:");
            labeledBody(defaultStatement.body());
        } else if (statement instanceof LabeledStatement labeled) {
            line(labeled.label() + ":");
            labeledBody(labeled.body());
        } else if (statement instanceof GotoStatement gotoStatement)
            line("goto " + gotoStatement.label() + ";");
        else if (statement instanceof ReturnStatement returnStatement)
            line((returnStatement.value() == null)
                ? "return;" : "return " + expression(returnStatement.value(), COMMA) + ";");
        else if (statement instanceof BreakStatement)
            line("break;");
        else if (statement instanceof ContinueStatement)
            line("continue;");
        else
            throw new IllegalArgumentException("Unknown statement: " + statement);
    }

    private void labeledBody(final Statement body) {
        depth++;
        statement(body);
        depth--;
    }

    private void ifStatement(final IfStatement statement) {
        var thenStatement = statement.thenStatement();
        final var elseStatement = statement.elseStatement();
        if (elseStatement != null && !(thenStatement instanceof CompoundStatement))
            thenStatement = new CompoundStatement(thenStatement);

        final boolean brace = open("if (" + expression(statement.condition(), COMMA) + ")", thenStatement);
        if (elseStatement == null) {
            if (brace)
                builder.append('\n');
            return;
        }
        builder.append(" else");
        if (elseStatement instanceof IfStatement || elseStatement instanceof CompoundStatement) {
            builder.append(' ');
            continuation = true;
            statement(elseStatement);
        } else {
            builder.append('\n');
            labeledBody(elseStatement);
        }
    }

    private String forHeader(final ForStatement statement) {
        final String initializer;
        if (!statement.declarations().isEmpty()) {
            final var first     = statement.declarations().get(0);
            final var specifier = storagePrefix(first.storage()) + specifier(base(first.type()));
            final var joiner    = new StringJoiner(", ", specifier + " ", "");
            for (final var declaration : statement.declarations()) {
                if (!specifier.equals(storagePrefix(declaration.storage()) + specifier(base(declaration.type()))))
                    throw new IllegalStateException("Declarations in a for header must share their specifiers");
                final var declarator = declarator(declaration.type(), declaration.name());
                joiner.add((declaration.initializer() == null)
                    ? declarator : declarator + " = " + initializer(declaration.initializer()));
            }
            initializer = joiner.toString();
        } else
            initializer = (statement.initializer() == null) ? "" : expression(statement.initializer(), COMMA);
        final var condition = (statement.condition() == null) ? "" : " " + expression(statement.condition(), COMMA);
        final var step      = (statement.step() == null) ? "" : " " + expression(statement.step(), COMMA);
        return "for (" + initializer + ";" + condition + ";" + step + ")";
    }
    //endregion

    //region Types and declarators
    private String typeName(final CType type) {
        return declaration(type, "");
    }

    private String declaration(final CType type, final String name) {
        final var declarator = declarator(type, name);
        final var specifier  = specifier(base(type));
        return declarator.isEmpty() ? specifier : specifier + " " + declarator;
    }

    /**
     * Returns the type specifier at the bottom of a derived type.
     */
    private static CType base(final CType type) {
        if (type instanceof PointerType pointer)
            return base(pointer.target());
        if (type instanceof ArrayType array)
            return base(array.element());
        if (type instanceof FunctionType function)
            return base(function.returnType());
        if (type instanceof QualifiedType qualified) {
            if (qualified.type() instanceof PointerType pointer)
                return base(pointer.target());
            if (qualified.type() instanceof ArrayType array)
                return base(new QualifiedType(qualified.qualifiers(), array.element()));
        }
        return type;
    }

    private String declarator(final CType type, final String inner) {
        if (type instanceof PointerType pointer)
            return pointerDeclarator(pointer.target(), "*" + inner);
        if (type instanceof QualifiedType qualified) {
            if (qualified.type() instanceof PointerType pointer)
                return pointerDeclarator(pointer.target(),
                    "*" + qualifiers(qualified) + (inner.isEmpty() ? "" : " " + inner));
            if (qualified.type() instanceof ArrayType array)
                return declarator(new ArrayType(new QualifiedType(qualified.qualifiers(), array.element()),
                    array.size()), inner);
            return inner;
        }
        if (type instanceof ArrayType array)
            return declarator(array.element(),
                inner + "[" + ((array.size() == null) ? "" : expression(array.size(), CONDITIONAL)) + "]");
        if (type instanceof FunctionType function)
            return declarator(function.returnType(), inner + "(" + parameters(function) + ")");
        return inner;
    }

    private String pointerDeclarator(final CType target, final String inner) {
        final var unqualified = (target instanceof QualifiedType qualified) ? qualified.type() : target;
        final boolean parenthesize = unqualified instanceof ArrayType || unqualified instanceof FunctionType;
        return declarator(target, parenthesize ? "(" + inner + ")" : inner);
    }

    private String parameters(final FunctionType function) {
        if (!function.prototype())
            return "";
        if (function.parameters().isEmpty())
            return function.variadic() ? "..." : "void";

        final var joiner = new StringJoiner(", ");
        for (final var parameter : function.parameters())
            joiner.add(declaration(parameter.type(), (parameter.name() == null) ? "" : parameter.name()));
        if (function.variadic())
            joiner.add("...");
        return joiner.toString();
    }

    private static String qualifiers(final QualifiedType type) {
        final var joiner = new StringJoiner(" ");
        for (final var qualifier : Qualifier.values())
            if (type.has(qualifier))
                joiner.add(qualifier.getKeyword());
        return joiner.toString();
    }

    private String specifier(final CType type) {
        if (type instanceof PrimitiveType primitive)
            return primitive.primitive().getSpelling();
        if (type instanceof TypedefName typedefName)
            return typedefName.name();
        if (type instanceof QualifiedType qualified)
            return qualifiers(qualified) + " " + specifier(qualified.type());
        if (type instanceof StructType struct) {
            final var text = new StringBuilder(struct.keyword());
            if (struct.tag() != null)
                text.append(' ').append(struct.tag());
            if (struct.members() != null) {
                text.append(" {\n");
                depth++;
                for (final var member : struct.members())
                    text.append(INDENT.repeat(depth)).append(declaration(member)).append(";\n");
                depth--;
                text.append(INDENT.repeat(depth)).append('}');
            }
            return text.toString();
        }
        if (type instanceof EnumType enumType) {
            final var text = new StringBuilder("enum");
            if (enumType.tag() != null)
                text.append(' ').append(enumType.tag());
            if (enumType.enumerators() != null) {
                final var joiner = new StringJoiner(", ", " { ", " }");
                for (final var enumerator : enumType.enumerators())
                    joiner.add((enumerator.value() == null)
                        ? enumerator.name() : enumerator.name() + " = " + expression(enumerator.value(), CONDITIONAL));
                text.append(joiner);
            }
            return text.toString();
        }
        throw new IllegalArgumentException("Not a type specifier: " + type);
    }
    //endregion

    //region Expressions and initializers
    private String initializer(final Initializer initializer) {
        if (initializer instanceof Expression expression)
            return expression(expression, ASSIGNMENT);
        if (initializer instanceof InitializerList list) {
            final var joiner = new StringJoiner(", ", "{", "}");
            for (final var item : list.items())
                joiner.add(initializer(item));
            return joiner.toString();
        }
        final var designated = (DesignatedInitializer) initializer;
        final var text = new StringBuilder();
        for (final var designator : designated.designators()) {
            if (designator instanceof MemberDesignator member)
                text.append('.').append(member.name());
            else
                text.append('[').append(expression(((IndexDesignator) designator).index(), COMMA)).append(']');
        }
        return text.append(" = ").append(initializer(designated.value())).toString();
    }

    private String expression(final Expression expression, final int minimumPrecedence) {
        final var text = unparenthesized(expression);
        return (precedence(expression) < minimumPrecedence) ? "(" + text + ")" : text;
    }

    private static int precedence(final Expression expression) {
        if (expression instanceof UnaryExpression unary)
            return unary.operator().isPostfix() ? POSTFIX : UNARY;
        if (expression instanceof SizeofTypeExpression)
            return UNARY;
        if (expression instanceof CallExpression || expression instanceof SubscriptExpression
                || expression instanceof MemberExpression || expression instanceof CompoundLiteral)
            return POSTFIX;
        if (expression instanceof CastExpression)
            return CAST;
        if (expression instanceof BinaryExpression binary)
            return binary.operator().getPrecedence();
        if (expression instanceof ConditionalExpression)
            return CONDITIONAL;
        if (expression instanceof AssignmentExpression)
            return ASSIGNMENT;
        if (expression instanceof CommaExpression)
            return COMMA;
        return PRIMARY;
    }

    private String unparenthesized(final Expression expression) {
        if (expression instanceof Identifier identifier)
            return identifier.name();
        if (expression instanceof IntegerConstant constant)
            return constant.text();
        if (expression instanceof FloatingConstant constant)
            return constant.text();
        if (expression instanceof CharacterConstant constant)
            return constant.text();
        if (expression instanceof StringLiteral literal)
            return literal.text();
        if (expression instanceof UnaryExpression unary) {
            final var operator = unary.operator();
            if (operator.isPostfix())
                return expression(unary.operand(), POSTFIX) + operator.getToken();
            if (operator == UnaryOperator.SIZEOF)
                return "sizeof(" + expression(unary.operand(), COMMA) + ")";
            final var operand = expression(unary.operand(), CAST);
            final var token   = operator.getToken();
            // "- -x" must not collapse into "--x".
            return (operand.charAt(0) == token.charAt(token.length() - 1)) ? token + " " + operand : token + operand;
        }
        if (expression instanceof SizeofTypeExpression sizeof)
            return "sizeof(" + typeName(sizeof.type()) + ")";
        if (expression instanceof BinaryExpression binary) {
            final int precedence = binary.operator().getPrecedence();
            return expression(binary.left(), precedence) + " " + binary.operator().getToken() + " "
                + expression(binary.right(), precedence + 1);
        }
        if (expression instanceof AssignmentExpression assignment)
            return expression(assignment.target(), UNARY) + " " + assignment.operator().getToken() + " "
                + expression(assignment.value(), ASSIGNMENT);
        if (expression instanceof ConditionalExpression conditional)
            return expression(conditional.condition(), CONDITIONAL + 1) + " ? "
                + expression(conditional.whenTrue(), COMMA) + " : "
                + expression(conditional.whenFalse(), CONDITIONAL);
        if (expression instanceof CallExpression call) {
            final var arguments = new ArrayList<String>();
            for (final var argument : call.arguments())
                arguments.add(expression(argument, ASSIGNMENT));
            return expression(call.callee(), POSTFIX) + "(" + String.join(", ", arguments) + ")";
        }
        if (expression instanceof SubscriptExpression subscript)
            return expression(subscript.array(), POSTFIX) + "[" + expression(subscript.index(), COMMA) + "]";
        if (expression instanceof MemberExpression member)
            return expression(member.base(), POSTFIX) + (member.arrow() ? "->" : ".") + member.member();
        if (expression instanceof CastExpression cast)
            return "(" + typeName(cast.type()) + ")" + expression(cast.operand(), CAST);
        if (expression instanceof CommaExpression comma) {
            final var joiner = new StringJoiner(", ");
            for (final var operand : comma.expressions())
                joiner.add(expression(operand, ASSIGNMENT));
            return joiner.toString();
        }
        if (expression instanceof CompoundLiteral literal)
            return "(" + typeName(literal.type()) + ")" + initializer(literal.initializer());
        throw new IllegalArgumentException("Unknown expression: " + expression);
    }
    //endregion
}
