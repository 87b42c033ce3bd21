package dev.blanke.cobfuscator.ast;

/**
 * A depth-first, read-only traversal over a syntax tree.
 * <p>
 * Each {@code visit} method visits the children of the passed node in source order. Subclasses override the methods
 * of the nodes they are interested in and call the super implementation where traversal should continue below that
 * node.
 *
 * @see TreeTransformer
 */
public abstract class TreeVisitor {

    public void visitSourceUnit(final SourceUnit unit) {
        for (final var declaration : unit.declarations())
            visitExternalDeclaration(declaration);
    }

    public void visitExternalDeclaration(final ExternalDeclaration declaration) {
        if (declaration instanceof FunctionDefinition function)
            visitFunctionDefinition(function);
        else
            visitBlockItem((BlockItem) declaration);
    }

    public void visitFunctionDefinition(final FunctionDefinition function) {
        visitType(function.type());
        visitCompoundStatement(function.body());
    }

    public void visitBlockItem(final BlockItem item) {
        if (item instanceof Declaration declaration)
            visitDeclaration(declaration);
        else if (item instanceof TypedefDeclaration typedef)
            visitTypedefDeclaration(typedef);
        else if (item instanceof TagDeclaration tag)
            visitTagDeclaration(tag);
        else
            visitStatement((Statement) item);
    }

    public void visitDeclaration(final Declaration declaration) {
        visitType(declaration.type());
        if (declaration.initializer() != null)
            visitInitializer(declaration.initializer());
    }

    public void visitTypedefDeclaration(final TypedefDeclaration typedef) {
        visitType(typedef.type());
    }

    public void visitTagDeclaration(final TagDeclaration tag) {
        visitType(tag.type());
    }

    //region Types
    public void visitType(final CType type) {
        if (type instanceof TypedefName typedefName)
            visitTypedefName(typedefName);
        else if (type instanceof StructType struct)
            visitStructType(struct);
        else if (type instanceof EnumType enumType)
            visitEnumType(enumType);
        else if (type instanceof PointerType pointer)
            visitType(pointer.target());
        else if (type instanceof ArrayType array) {
            visitType(array.element());
            if (array.size() != null)
                visitExpression(array.size());
        } else if (type instanceof FunctionType function)
            visitFunctionType(function);
        else if (type instanceof QualifiedType qualified)
            visitType(qualified.type());
    }

    public void visitTypedefName(final TypedefName typedefName) {
    }

    public void visitStructType(final StructType struct) {
        if (struct.members() != null)
            for (final var member : struct.members())
                visitDeclaration(member);
    }

    public void visitEnumType(final EnumType enumType) {
        if (enumType.enumerators() != null)
            for (final var enumerator : enumType.enumerators())
                visitEnumerator(enumerator);
    }

    public void visitEnumerator(final Enumerator enumerator) {
        if (enumerator.value() != null)
            visitExpression(enumerator.value());
    }

    public void visitFunctionType(final FunctionType function) {
        visitType(function.returnType());
        for (final var parameter : function.parameters())
            visitParameter(parameter);
    }

    public void visitParameter(final Parameter parameter) {
        visitType(parameter.type());
    }
    //endregion

    //region Initializers
    public void visitInitializer(final Initializer initializer) {
        if (initializer instanceof Expression expression)
            visitExpression(expression);
        else if (initializer instanceof InitializerList list)
            visitInitializerList(list);
        else if (initializer instanceof DesignatedInitializer designated)
            visitDesignatedInitializer(designated);
    }

    public void visitInitializerList(final InitializerList list) {
        for (final var item : list.items())
            visitInitializer(item);
    }

    public void visitDesignatedInitializer(final DesignatedInitializer designated) {
        for (final var designator : designated.designators()) {
            if (designator instanceof IndexDesignator index)
                visitExpression(index.index());
            else
                visitMemberDesignator((MemberDesignator) designator);
        }
        visitInitializer(designated.value());
    }

    public void visitMemberDesignator(final MemberDesignator designator) {
    }
    //endregion

    //region Statements
    public void visitStatement(final Statement statement) {
        if (statement instanceof CompoundStatement compound)
            visitCompoundStatement(compound);
        else if (statement instanceof ExpressionStatement expression)
            visitExpressionStatement(expression);
        else if (statement instanceof IfStatement ifStatement)
            visitIfStatement(ifStatement);
        else if (statement instanceof WhileStatement whileStatement)
            visitWhileStatement(whileStatement);
        else if (statement instanceof DoWhileStatement doWhile)
            visitDoWhileStatement(doWhile);
        else if (statement instanceof ForStatement forStatement)
            visitForStatement(forStatement);
        else if (statement instanceof SwitchStatement switchStatement)
            visitSwitchStatement(switchStatement);
        else if (statement instanceof CaseStatement caseStatement)
            visitCaseStatement(caseStatement);
        else if (statement instanceof DefaultStatement defaultStatement)
            visitDefaultStatement(defaultStatement);
        else if (statement instanceof LabeledStatement labeled)
            visitLabeledStatement(labeled);
        else if (statement instanceof GotoStatement gotoStatement)
            visitGotoStatement(gotoStatement);
        else if (statement instanceof ReturnStatement returnStatement)
            visitReturnStatement(returnStatement);
        else if (statement instanceof BreakStatement breakStatement)
            visitBreakStatement(breakStatement);
        else if (statement instanceof ContinueStatement continueStatement)
            visitContinueStatement(continueStatement);
        else
            throw new IllegalArgumentException("Unknown statement: " + statement);
    }

    public void visitCompoundStatement(final CompoundStatement compound) {
        for (final var item : compound.items())
            visitBlockItem(item);
    }

    public void visitExpressionStatement(final ExpressionStatement statement) {
        if (statement.expression() != null)
            visitExpression(statement.expression());
    }

    public void visitIfStatement(final IfStatement statement) {
        visitExpression(statement.condition());
        visitStatement(statement.thenStatement());
        if (statement.elseStatement() != null)
            visitStatement(statement.elseStatement());
    }

    public void visitWhileStatement(final WhileStatement statement) {
        visitExpression(statement.condition());
        visitStatement(statement.body());
    }

    public void visitDoWhileStatement(final DoWhileStatement statement) {
        visitStatement(statement.body());
        visitExpression(statement.condition());
    }

    public void visitForStatement(final ForStatement statement) {
        for (final var declaration : statement.declarations())
            visitDeclaration(declaration);
        if (statement.initializer() != null)
            visitExpression(statement.initializer());
        if (statement.condition() != null)
            visitExpression(statement.condition());
        if (statement.step() != null)
            visitExpression(statement.step());
        visitStatement(statement.body());
    }

    public void visitSwitchStatement(final SwitchStatement statement) {
        visitExpression(statement.selector());
        visitStatement(statement.body());
    }

    public void visitCaseStatement(final CaseStatement statement) {
        visitExpression(statement.value());
        visitStatement(statement.body());
    }

    public void visitDefaultStatement(final DefaultStatement statement) {
        visitStatement(statement.body());
    }

    public void visitLabeledStatement(final LabeledStatement statement) {
        visitStatement(statement.body());
    }

    public void visitGotoStatement(final GotoStatement statement) {
    }

    public void visitReturnStatement(final ReturnStatement statement) {
        if (statement.value() != null)
            visitExpression(statement.value());
    }

    public void visitBreakStatement(final BreakStatement statement) {
    }

    public void visitContinueStatement(final ContinueStatement statement) {
    }
    //endregion

    //region Expressions
    public void visitExpression(final Expression expression) {
        if (expression instanceof Identifier identifier)
            visitIdentifier(identifier);
        else if (expression instanceof IntegerConstant || expression instanceof FloatingConstant
                || expression instanceof CharacterConstant || expression instanceof StringLiteral)
            visitLiteral(expression);
        else if (expression instanceof UnaryExpression unary)
            visitUnaryExpression(unary);
        else if (expression instanceof SizeofTypeExpression sizeof)
            visitSizeofTypeExpression(sizeof);
        else if (expression instanceof BinaryExpression binary)
            visitBinaryExpression(binary);
        else if (expression instanceof AssignmentExpression assignment)
            visitAssignmentExpression(assignment);
        else if (expression instanceof ConditionalExpression conditional)
            visitConditionalExpression(conditional);
        else if (expression instanceof CallExpression call)
            visitCallExpression(call);
        else if (expression instanceof SubscriptExpression subscript)
            visitSubscriptExpression(subscript);
        else if (expression instanceof MemberExpression member)
            visitMemberExpression(member);
        else if (expression instanceof CastExpression cast)
            visitCastExpression(cast);
        else if (expression instanceof CommaExpression comma)
            visitCommaExpression(comma);
        else if (expression instanceof CompoundLiteral literal)
            visitCompoundLiteral(literal);
        else
            throw new IllegalArgumentException("Unknown expression: " + expression);
    }

    public void visitIdentifier(final Identifier identifier) {
    }

    public void visitLiteral(final Expression literal) {
    }

    public void visitUnaryExpression(final UnaryExpression expression) {
        visitExpression(expression.operand());
    }

    public void visitSizeofTypeExpression(final SizeofTypeExpression expression) {
        visitType(expression.type());
    }

    public void visitBinaryExpression(final BinaryExpression expression) {
        visitExpression(expression.left());
        visitExpression(expression.right());
    }

    public void visitAssignmentExpression(final AssignmentExpression expression) {
        visitExpression(expression.target());
        visitExpression(expression.value());
    }

    public void visitConditionalExpression(final ConditionalExpression expression) {
        visitExpression(expression.condition());
        visitExpression(expression.whenTrue());
        visitExpression(expression.whenFalse());
    }

    public void visitCallExpression(final CallExpression expression) {
        visitExpression(expression.callee());
        for (final var argument : expression.arguments())
            visitExpression(argument);
    }

    public void visitSubscriptExpression(final SubscriptExpression expression) {
        visitExpression(expression.array());
        visitExpression(expression.index());
    }

    public void visitMemberExpression(final MemberExpression expression) {
        visitExpression(expression.base());
    }

    public void visitCastExpression(final CastExpression expression) {
        visitType(expression.type());
        visitExpression(expression.operand());
    }

    public void visitCommaExpression(final CommaExpression expression) {
        for (final var operand : expression.expressions())
            visitExpression(operand);
    }

    public void visitCompoundLiteral(final CompoundLiteral literal) {
        visitType(literal.type());
        visitInitializerList(literal.initializer());
    }
    //endregion
}
