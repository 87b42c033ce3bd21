package dev.blanke.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.jetbrains.annotations.Nullable;

/**
 * A depth-first traversal producing a new syntax tree.
 * <p>
 * Each {@code transform} method receives a node of the <em>original</em> tree, so that analysis results attached to
 * it by identity can still be looked up, and returns its replacement. The default implementations transform the
 * children and rebuild the node; if no child changed, the original node is returned as-is, so that unchanged subtrees
 * are shared between the old and new tree.
 * <p>
 * In copying mode every node is rebuilt, which yields a deep copy consisting of fresh instances only. Duplicated code
 * must be copied that way, as analyses distinguish nodes by identity.
 *
 * @see TreeVisitor
 * @see Trees#copy(Statement)
 */
public abstract class TreeTransformer {

    private final boolean copying;

    protected TreeTransformer() {
        this(false);
    }

    protected TreeTransformer(final boolean copying) {
        this.copying = copying;
    }

    /**
     * Decides whether a node whose children are all identical to the transformed ones can be reused.
     */
    private boolean reuse(final boolean unchanged) {
        return unchanged && !copying;
    }

    private static boolean same(final List<?> original, final List<?> transformed) {
        if (original.size() != transformed.size())
            return false;
        for (int i = 0; i < original.size(); i++)
            if (original.get(i) != transformed.get(i))
                return false;
        return true;
    }

    private static <T, R> List<R> map(final List<T> list, final Function<? super T, ? extends R> function) {
        final var result = new ArrayList<R>(list.size());
        for (final var element : list)
            result.add(function.apply(element));
        return result;
    }

    private @Nullable Expression transformNullable(final @Nullable Expression expression) {
        return (expression == null) ? null : transformExpression(expression);
    }

    public SourceUnit transformSourceUnit(final SourceUnit unit) {
        final var declarations = new ArrayList<ExternalDeclaration>();
        for (final var declaration : unit.declarations())
            declarations.addAll(transformExternalDeclaration(declaration));
        return reuse(same(unit.declarations(), declarations)) ? unit : new SourceUnit(declarations);
    }

    public List<ExternalDeclaration> transformExternalDeclaration(final ExternalDeclaration declaration) {
        if (declaration instanceof FunctionDefinition function)
            return List.of(transformFunctionDefinition(function));
        if (declaration instanceof Declaration variable)
            return List.of(transformDeclaration(variable));
        if (declaration instanceof TypedefDeclaration typedef)
            return List.of(transformTypedefDeclaration(typedef));
        return List.of(transformTagDeclaration((TagDeclaration) declaration));
    }

    public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
        final var type = (FunctionType) transformType(function.type());
        final var body = transformCompoundStatement(function.body());
        return reuse(type == function.type() && body == function.body())
            ? function : new FunctionDefinition(function.name(), type, function.storage(), body);
    }

    /**
     * Transforms a single item of a compound statement into any number of items.
     */
    public List<BlockItem> transformBlockItem(final BlockItem item) {
        if (item instanceof Declaration declaration)
            return List.of(transformDeclaration(declaration));
        if (item instanceof TypedefDeclaration typedef)
            return List.of(transformTypedefDeclaration(typedef));
        if (item instanceof TagDeclaration tag)
            return List.of(transformTagDeclaration(tag));
        return List.of(transformStatement((Statement) item));
    }

    public Declaration transformDeclaration(final Declaration declaration) {
        final var type        = transformType(declaration.type());
        final var initializer = (declaration.initializer() == null)
            ? null : transformInitializer(declaration.initializer());
        return reuse(type == declaration.type() && initializer == declaration.initializer())
            ? declaration : new Declaration(declaration.name(), type, declaration.storage(), initializer);
    }

    public TypedefDeclaration transformTypedefDeclaration(final TypedefDeclaration typedef) {
        final var type = transformType(typedef.type());
        return reuse(type == typedef.type()) ? typedef : new TypedefDeclaration(typedef.name(), type);
    }

    public TagDeclaration transformTagDeclaration(final TagDeclaration tag) {
        final var type = transformType(tag.type());
        return reuse(type == tag.type()) ? tag : new TagDeclaration(type);
    }

    //region Types
    public CType transformType(final CType type) {
        if (type instanceof PrimitiveType primitive)
            return reuse(true) ? primitive : new PrimitiveType(primitive.primitive());
        if (type instanceof TypedefName typedefName)
            return transformTypedefName(typedefName);
        if (type instanceof StructType struct)
            return transformStructType(struct);
        if (type instanceof EnumType enumType)
            return transformEnumType(enumType);
        if (type instanceof PointerType pointer) {
            final var target = transformType(pointer.target());
            return reuse(target == pointer.target()) ? pointer : new PointerType(target);
        }
        if (type instanceof ArrayType array) {
            final var element = transformType(array.element());
            final var size    = transformNullable(array.size());
            return reuse(element == array.element() && size == array.size()) ? array : new ArrayType(element, size);
        }
        if (type instanceof FunctionType function)
            return transformFunctionType(function);
        if (type instanceof QualifiedType qualified) {
            final var inner = transformType(qualified.type());
            return reuse(inner == qualified.type()) ? qualified : new QualifiedType(qualified.qualifiers(), inner);
        }
        throw new IllegalArgumentException("Unknown type: " + type);
    }

    public CType transformTypedefName(final TypedefName typedefName) {
        return reuse(true) ? typedefName : new TypedefName(typedefName.name());
    }

    public CType transformStructType(final StructType struct) {
        if (struct.members() == null)
            return reuse(true) ? struct : new StructType(struct.union(), struct.tag(), null);
        final var members = map(struct.members(), this::transformDeclaration);
        return reuse(same(struct.members(), members)) ? struct : new StructType(struct.union(), struct.tag(), members);
    }

    public CType transformEnumType(final EnumType enumType) {
        if (enumType.enumerators() == null)
            return reuse(true) ? enumType : new EnumType(enumType.tag(), null);
        final var enumerators = map(enumType.enumerators(), this::transformEnumerator);
        return reuse(same(enumType.enumerators(), enumerators)) ? enumType : new EnumType(enumType.tag(), enumerators);
    }

    public Enumerator transformEnumerator(final Enumerator enumerator) {
        final var value = transformNullable(enumerator.value());
        return reuse(value == enumerator.value()) ? enumerator : new Enumerator(enumerator.name(), value);
    }

    public CType transformFunctionType(final FunctionType function) {
        final var returnType = transformType(function.returnType());
        final var parameters = map(function.parameters(), this::transformParameter);
        return reuse(returnType == function.returnType() && same(function.parameters(), parameters))
            ? function : new FunctionType(returnType, parameters, function.variadic(), function.prototype());
    }

    public Parameter transformParameter(final Parameter parameter) {
        final var type = transformType(parameter.type());
        return reuse(type == parameter.type()) ? parameter : new Parameter(parameter.name(), type);
    }
    //endregion

    //region Initializers
    public Initializer transformInitializer(final Initializer initializer) {
        if (initializer instanceof Expression expression)
            return transformExpression(expression);
        if (initializer instanceof InitializerList list)
            return transformInitializerList(list);
        return transformDesignatedInitializer((DesignatedInitializer) initializer);
    }

    public InitializerList transformInitializerList(final InitializerList list) {
        final var items = map(list.items(), this::transformInitializer);
        return reuse(same(list.items(), items)) ? list : new InitializerList(items);
    }

    public Initializer transformDesignatedInitializer(final DesignatedInitializer designated) {
        final var designators = map(designated.designators(), this::transformDesignator);
        final var value       = transformInitializer(designated.value());
        return reuse(same(designated.designators(), designators) && value == designated.value())
            ? designated : new DesignatedInitializer(designators, value);
    }

    public Designator transformDesignator(final Designator designator) {
        if (designator instanceof IndexDesignator index) {
            final var expression = transformExpression(index.index());
            return reuse(expression == index.index()) ? index : new IndexDesignator(expression);
        }
        final var member = (MemberDesignator) designator;
        return reuse(true) ? member : new MemberDesignator(member.name());
    }
    //endregion

    //region Statements
    public Statement transformStatement(final Statement statement) {
        if (statement instanceof CompoundStatement compound)
            return transformCompoundStatement(compound);
        if (statement instanceof ExpressionStatement expression)
            return transformExpressionStatement(expression);
        if (statement instanceof IfStatement ifStatement)
            return transformIfStatement(ifStatement);
        if (statement instanceof WhileStatement whileStatement)
            return transformWhileStatement(whileStatement);
        if (statement instanceof DoWhileStatement doWhile)
            return transformDoWhileStatement(doWhile);
        if (statement instanceof ForStatement forStatement)
            return transformForStatement(forStatement);
        if (statement instanceof SwitchStatement switchStatement)
            return transformSwitchStatement(switchStatement);
        if (statement instanceof CaseStatement caseStatement)
            return transformCaseStatement(caseStatement);
        if (statement instanceof DefaultStatement defaultStatement)
            return transformDefaultStatement(defaultStatement);
        if (statement instanceof LabeledStatement labeled)
            return transformLabeledStatement(labeled);
        if (statement instanceof GotoStatement gotoStatement)
            return transformGotoStatement(gotoStatement);
        if (statement instanceof ReturnStatement returnStatement)
            return transformReturnStatement(returnStatement);
        if (statement instanceof BreakStatement breakStatement)
            return reuse(true) ? breakStatement : new BreakStatement();
        if (statement instanceof ContinueStatement continueStatement)
            return reuse(true) ? continueStatement : new ContinueStatement();
        throw new IllegalArgumentException("Unknown statement: " + statement);
    }

    public CompoundStatement transformCompoundStatement(final CompoundStatement compound) {
        final var items = new ArrayList<BlockItem>(compound.items().size());
        for (final var item : compound.items())
            items.addAll(transformBlockItem(item));
        return reuse(same(compound.items(), items)) ? compound : new CompoundStatement(items);
    }

    public Statement transformExpressionStatement(final ExpressionStatement statement) {
        final var expression = transformNullable(statement.expression());
        return reuse(expression == statement.expression()) ? statement : new ExpressionStatement(expression);
    }

    public Statement transformIfStatement(final IfStatement statement) {
        final var condition     = transformExpression(statement.condition());
        final var thenStatement = transformStatement(statement.thenStatement());
        final var elseStatement = (statement.elseStatement() == null)
            ? null : transformStatement(statement.elseStatement());
        return reuse(condition == statement.condition() && thenStatement == statement.thenStatement()
                && elseStatement == statement.elseStatement())
            ? statement : new IfStatement(condition, thenStatement, elseStatement);
    }

    public Statement transformWhileStatement(final WhileStatement statement) {
        final var condition = transformExpression(statement.condition());
        final var body      = transformStatement(statement.body());
        return reuse(condition == statement.condition() && body == statement.body())
            ? statement : new WhileStatement(condition, body);
    }

    public Statement transformDoWhileStatement(final DoWhileStatement statement) {
        final var body      = transformStatement(statement.body());
        final var condition = transformExpression(statement.condition());
        return reuse(condition == statement.condition() && body == statement.body())
            ? statement : new DoWhileStatement(body, condition);
    }

    public Statement transformForStatement(final ForStatement statement) {
        final var declarations = map(statement.declarations(), this::transformDeclaration);
        final var initializer  = transformNullable(statement.initializer());
        final var condition    = transformNullable(statement.condition());
        final var step         = transformNullable(statement.step());
        final var body         = transformStatement(statement.body());
        return reuse(same(statement.declarations(), declarations) && initializer == statement.initializer()
                && condition == statement.condition() && step == statement.step() && body == statement.body())
            ? statement : new ForStatement(declarations, initializer, condition, step, body);
    }

    public Statement transformSwitchStatement(final SwitchStatement statement) {
        final var selector = transformExpression(statement.selector());
        final var body     = transformStatement(statement.body());
        return reuse(selector == statement.selector() && body == statement.body())
            ? statement : new SwitchStatement(selector, body);
    }

    public Statement transformCaseStatement(final CaseStatement statement) {
        final var value = transformExpression(statement.value());
        final var body  = transformStatement(statement.body());
        return reuse(value == statement.value() && body == statement.body())
            ? statement : new CaseStatement(value, body);
    }

    public Statement transformDefaultStatement(final DefaultStatement statement) {
        final var body = transformStatement(statement.body());
        return reuse(body == statement.body()) ? statement : new DefaultStatement(body);
    }

    public Statement transformLabeledStatement(final LabeledStatement statement) {
        final var body = transformStatement(statement.body());
        return reuse(body == statement.body()) ? statement : new LabeledStatement(statement.label(), body);
    }

    public Statement transformGotoStatement(final GotoStatement statement) {
        return reuse(true) ? statement : new GotoStatement(statement.label());
    }

    public Statement transformReturnStatement(final ReturnStatement statement) {
        final var value = transformNullable(statement.value());
        return reuse(value == statement.value()) ? statement : new ReturnStatement(value);
    }
    //endregion

    //region Expressions
    public Expression transformExpression(final Expression expression) {
        if (expression instanceof Identifier identifier)
            return transformIdentifier(identifier);
        if (expression instanceof IntegerConstant constant)
            return reuse(true) ? constant : new IntegerConstant(constant.text());
        if (expression instanceof FloatingConstant constant)
            return reuse(true) ? constant : new FloatingConstant(constant.text());
        if (expression instanceof CharacterConstant constant)
            return reuse(true) ? constant : new CharacterConstant(constant.text());
        if (expression instanceof StringLiteral literal)
            return reuse(true) ? literal : new StringLiteral(literal.text());
        if (expression instanceof UnaryExpression unary)
            return transformUnaryExpression(unary);
        if (expression instanceof SizeofTypeExpression sizeof) {
            final var type = transformType(sizeof.type());
            return reuse(type == sizeof.type()) ? sizeof : new SizeofTypeExpression(type);
        }
        if (expression instanceof BinaryExpression binary)
            return transformBinaryExpression(binary);
        if (expression instanceof AssignmentExpression assignment)
            return transformAssignmentExpression(assignment);
        if (expression instanceof ConditionalExpression conditional)
            return transformConditionalExpression(conditional);
        if (expression instanceof CallExpression call)
            return transformCallExpression(call);
        if (expression instanceof SubscriptExpression subscript)
            return transformSubscriptExpression(subscript);
        if (expression instanceof MemberExpression member)
            return transformMemberExpression(member);
        if (expression instanceof CastExpression cast) {
            final var type    = transformType(cast.type());
            final var operand = transformExpression(cast.operand());
            return reuse(type == cast.type() && operand == cast.operand())
                ? cast : new CastExpression(type, operand);
        }
        if (expression instanceof CommaExpression comma) {
            final var expressions = map(comma.expressions(), this::transformExpression);
            return reuse(same(comma.expressions(), expressions)) ? comma : new CommaExpression(expressions);
        }
        if (expression instanceof CompoundLiteral literal) {
            final var type        = transformType(literal.type());
            final var initializer = transformInitializerList(literal.initializer());
            return reuse(type == literal.type() && initializer == literal.initializer())
                ? literal : new CompoundLiteral(type, initializer);
        }
        throw new IllegalArgumentException("Unknown expression: " + expression);
    }

    public Expression transformIdentifier(final Identifier identifier) {
        return reuse(true) ? identifier : new Identifier(identifier.name());
    }

    public Expression transformUnaryExpression(final UnaryExpression expression) {
        final var operand = transformExpression(expression.operand());
        return reuse(operand == expression.operand())
            ? expression : new UnaryExpression(expression.operator(), operand);
    }

    public Expression transformBinaryExpression(final BinaryExpression expression) {
        final var left  = transformExpression(expression.left());
        final var right = transformExpression(expression.right());
        return reuse(left == expression.left() && right == expression.right())
            ? expression : new BinaryExpression(expression.operator(), left, right);
    }

    public Expression transformAssignmentExpression(final AssignmentExpression expression) {
        final var target = transformExpression(expression.target());
        final var value  = transformExpression(expression.value());
        return reuse(target == expression.target() && value == expression.value())
            ? expression : new AssignmentExpression(expression.operator(), target, value);
    }

    public Expression transformConditionalExpression(final ConditionalExpression expression) {
        final var condition = transformExpression(expression.condition());
        final var whenTrue  = transformExpression(expression.whenTrue());
        final var whenFalse = transformExpression(expression.whenFalse());
        return reuse(condition == expression.condition() && whenTrue == expression.whenTrue()
                && whenFalse == expression.whenFalse())
            ? expression : new ConditionalExpression(condition, whenTrue, whenFalse);
    }

    public Expression transformCallExpression(final CallExpression expression) {
        final var callee    = transformExpression(expression.callee());
        final var arguments = map(expression.arguments(), this::transformExpression);
        return reuse(callee == expression.callee() && same(expression.arguments(), arguments))
            ? expression : new CallExpression(callee, arguments);
    }

    public Expression transformSubscriptExpression(final SubscriptExpression expression) {
        final var array = transformExpression(expression.array());
        final var index = transformExpression(expression.index());
        return reuse(array == expression.array() && index == expression.index())
            ? expression : new SubscriptExpression(array, index);
    }

    public Expression transformMemberExpression(final MemberExpression expression) {
        final var base = transformExpression(expression.base());
        return reuse(base == expression.base())
            ? expression : new MemberExpression(base, expression.member(), expression.arrow());
    }
    //endregion
}
