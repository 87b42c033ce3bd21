package dev.blanke.cobfuscator.transform;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.cfg.BasicBlock;
import dev.blanke.cobfuscator.analysis.cfg.Branch;
import dev.blanke.cobfuscator.analysis.cfg.ControlFlowGraph;
import dev.blanke.cobfuscator.analysis.cfg.ControlFlowGraphBuilder;
import dev.blanke.cobfuscator.analysis.cfg.Fallthrough;
import dev.blanke.cobfuscator.analysis.cfg.Jump;
import dev.blanke.cobfuscator.analysis.cfg.Return;
import dev.blanke.cobfuscator.analysis.cfg.SwitchDispatch;
import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.analysis.scope.Scope;
import dev.blanke.cobfuscator.ast.ArrayType;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.BreakStatement;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CallExpression;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.CharacterConstant;
import dev.blanke.cobfuscator.ast.CommaExpression;
import dev.blanke.cobfuscator.ast.CompoundLiteral;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.ContinueStatement;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.DefaultStatement;
import dev.blanke.cobfuscator.ast.DesignatedInitializer;
import dev.blanke.cobfuscator.ast.EnumType;
import dev.blanke.cobfuscator.ast.Enumerator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.ExpressionStatement;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.Initializer;
import dev.blanke.cobfuscator.ast.InitializerList;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.PointerType;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.QualifiedType;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.ReturnStatement;
import dev.blanke.cobfuscator.ast.SizeofTypeExpression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.StringLiteral;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.SubscriptExpression;
import dev.blanke.cobfuscator.ast.SwitchStatement;
import dev.blanke.cobfuscator.ast.TagDeclaration;
import dev.blanke.cobfuscator.ast.TreeTransformer;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.TypedefDeclaration;
import dev.blanke.cobfuscator.ast.TypedefName;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;
import dev.blanke.cobfuscator.ast.WhileStatement;

/**
 * Flattens the control flow of every function into a dispatch loop: each basic block becomes one case of a
 * {@code switch} statement over a state variable, and each transfer of control becomes an assignment to that variable
 * followed by a jump back to the dispatcher.
 * <pre>{@code
 * int state = 0;
 * while (1) {
 *     switch (state) {
 *     case 0: { ...; if (c) state = 1; else state = 2; continue; }
 *     case 1: { ...; return x; }
 *     ...
 *     }
 * }
 * }</pre>
 * Since the cases share one scope, all local declarations are hoisted to the start of the function. Initializers
 * become assignments at the point of the original declaration, and variables, typedefs, tags and enumeration constants
 * are renamed where hoisting them would change which declaration a name refers to. One-dimensional variable length arrays become pointers to memory
 * obtained from {@code __builtin_alloca}.
 */
public final class ControlFlowFlattening implements Transform {

    private static final Logger LOGGER = System.getLogger(ControlFlowFlattening.class.getName());

    private final boolean randomiseCases;

    private final CaseStyle caseStyle;

    public ControlFlowFlattening(final boolean randomiseCases, final CaseStyle caseStyle) {
        this.randomiseCases = randomiseCases;
        this.caseStyle      = caseStyle;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return new FlatteningTransformer(unit, random).transform();
    }

    private final class FlatteningTransformer extends ObfuscatingTransformer {

        private final NameAllocator names;

        FlatteningTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
            names = new NameAllocator(scopes);
        }

        @Override
        public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
            if (function.body().items().isEmpty())
                return function;
            final var flattened = new FunctionFlattener(function).flatten();
            LOGGER.log(Level.DEBUG, "Flattened ''{0}''", function.name());
            return flattened;
        }

        /**
         * Flattens a single function.
         */
        private final class FunctionFlattener extends TreeTransformer {

            private final FunctionDefinition function;

            private final Scope functionScope;

            private final List<BlockItem> localDeclarations = new ArrayList<>();

            /**
             * Fresh names of contested variables, typedefs, tags and enumeration constants, by binding.
             */
            private final Map<Binding, String> renamed = new IdentityHashMap<>();

            private final Set<Binding> variableLengthArrays = Collections.newSetFromMap(new IdentityHashMap<>());

            FunctionFlattener(final FunctionDefinition function) {
                this.function      = function;
                this.functionScope = scopes.functionScopeOf(function);
            }

            FunctionDefinition flatten() {
                collectLocalDeclarations();

                final var hoisted = new ArrayList<BlockItem>();
                for (final var item : localDeclarations)
                    hoisted.add(hoist(item));

                final var body = transformCompoundStatement(function.body());
                final var graph = ControlFlowGraphBuilder.build(
                    new FunctionDefinition(function.name(), function.type(), function.storage(), body));
                return new FunctionDefinition(function.name(), function.type(), function.storage(),
                    new CompoundStatement(dispatcher(graph, hoisted)));
            }

            //region Hoisting
            private void collectLocalDeclarations() {
                new TreeVisitor() {

                    @Override
                    public void visitBlockItem(final BlockItem item) {
                        if (!(item instanceof Statement))
                            localDeclarations.add(item);
                        super.visitBlockItem(item);
                    }

                    @Override
                    public void visitForStatement(final ForStatement statement) {
                        localDeclarations.addAll(statement.declarations());
                        super.visitForStatement(statement);
                    }
                }.visitCompoundStatement(function.body());

                for (final var item : localDeclarations) {
                    if (item instanceof Declaration declaration)
                        planVariable(declaration);
                    else
                        planTypeDeclaration(item);
                }
            }

            /**
             * Whether a binding other than the passed one carrying the same name occurs within the function, which
             * would either capture or be captured by the hoisted declaration.
             */
            private boolean isNameContested(final Binding binding) {
                for (final var other : scopes.bindingsNamed(binding.getName())) {
                    if (other == binding || other.getNameSpace() != binding.getNameSpace())
                        continue;
                    for (final var occurrence : other.getOccurrences())
                        if (functionScope.encloses(occurrence.point().scope()))
                            return true;
                }
                return false;
            }

            /**
             * Assigns fresh names to the typedefs, tags and enumeration constants declared by the passed item whose
             * names are also declared elsewhere within the function.
             */
            private void planTypeDeclaration(final BlockItem item) {
                new TreeVisitor() {

                    @Override
                    public void visitTypedefDeclaration(final TypedefDeclaration typedef) {
                        final var binding = scopes.bindingOf(typedef);
                        if (binding != null && isNameContested(binding))
                            rename(binding);
                        if (expressions.getTypes().isVariablyModified(typedef.type()))
                            throw new PreconditionViolationException("Cannot hoist variably modified type '"
                                + typedef.name() + "' in function '" + function.name() + "'");
                        super.visitTypedefDeclaration(typedef);
                    }

                    @Override
                    public void visitStructType(final StructType struct) {
                        planTag(struct);
                        super.visitStructType(struct);
                    }

                    @Override
                    public void visitEnumType(final EnumType enumType) {
                        planTag(enumType);
                        if (enumType.enumerators() != null)
                            for (final var enumerator : enumType.enumerators()) {
                                final var binding = scopes.bindingOf(enumerator);
                                if (binding != null && isNameContested(binding))
                                    rename(binding);
                            }
                        super.visitEnumType(enumType);
                    }

                    @Override
                    public void visitExpression(final Expression expression) {
                    }
                }.visitBlockItem(item);
            }

            private void planTag(final CType specifier) {
                final var binding = scopes.bindingOf(specifier);
                if (binding != null && binding.getScope() != scopes.getFileScope() && isNameContested(binding))
                    rename(binding);
            }

            private void rename(final Binding binding) {
                renamed.computeIfAbsent(binding, contested -> names.allocate(contested.getName()));
            }

            private void planVariable(final Declaration declaration) {
                final var binding = scopes.bindingOf(declaration);
                if (binding == null)
                    throw new PreconditionViolationException("Unresolved declaration of '" + declaration.name() + "'");
                planTypeDeclaration(declaration);

                final var types = expressions.getTypes();
                final var type  = types.resolveUnqualified(declaration.type());
                if (binding.getKind() == BindingKind.VARIABLE && binding.isAutomatic()) {
                    if (type instanceof ArrayType resolved && declaration.initializer() instanceof InitializerList
                            && (Trees.isQualified(types.resolve(resolved.element()), Qualifier.CONST)
                                || Trees.isQualified(types.resolve(declaration.type()), Qualifier.CONST)))
                        throw new PreconditionViolationException("Cannot hoist const array '" + declaration.name()
                            + "' with an initializer list");
                    if (types.isVariablyModified(declaration.type())) {
                        if (!(declaration.type() instanceof ArrayType declared) || declared.size() == null
                                || types.isVariablyModified(declared.element()))
                            throw new PreconditionViolationException("Cannot hoist multi-dimensional variable length"
                                + " array '" + declaration.name() + "'");
                        variableLengthArrays.add(binding);
                    }
                }
                if (isNameContested(binding)) {
                    if (binding.getKind() != BindingKind.VARIABLE || binding.getStorage() == StorageClass.EXTERN)
                        throw new PreconditionViolationException("Conflicting declarations of '"
                            + declaration.name() + "' in function '" + function.name() + "'");
                    renamed.put(binding, names.allocate(declaration.name()));
                }
            }

            private String nameOf(final Node node, final String name) {
                final var binding = scopes.bindingOf(node);
                final var fresh = (binding == null) ? null : renamed.get(binding);
                return (fresh == null) ? name : fresh;
            }

            private String nameOf(final Declaration declaration) {
                return nameOf(declaration, declaration.name());
            }

            private boolean isAutomatic(final Declaration declaration) {
                final var binding = scopes.bindingOf(declaration);
                return binding != null && binding.getKind() == BindingKind.VARIABLE && binding.isAutomatic();
            }

            private BlockItem hoist(final BlockItem item) {
                if (item instanceof TypedefDeclaration typedef)
                    return transformTypedefDeclaration(typedef);
                if (item instanceof TagDeclaration tag)
                    return transformTagDeclaration(tag);

                final var declaration = (Declaration) item;
                if (!isAutomatic(declaration))
                    return new Declaration(nameOf(declaration), transformType(declaration.type()),
                        declaration.storage(), (declaration.initializer() == null)
                            ? null : transformInitializer(declaration.initializer()));

                final var binding = scopes.bindingOf(declaration);
                if (variableLengthArrays.contains(binding))
                    return new Declaration(nameOf(declaration),
                        new PointerType(copyType(((ArrayType) declaration.type()).element())),
                        declaration.storage(), null);

                var type = stripConst(transformType(declaration.type()));
                final var literal = stringInitializer(declaration);
                if (literal != null && type instanceof ArrayType array)
                    type = new ArrayType(stripConst(array.element()), (array.size() == null)
                        ? IntegerConstant.of(characters(declaration, literal).size() + 1) : array.size());
                else if (type instanceof ArrayType array && array.size() == null
                        && declaration.initializer() instanceof InitializerList list)
                    type = new ArrayType(array.element(), IntegerConstant.of(list.items().size()));
                if (declaration.initializer() != null
                        && Trees.isQualified(expressions.getTypes().resolve(type), Qualifier.CONST))
                    throw new PreconditionViolationException("Cannot assign the initial value of const '"
                        + declaration.name() + "'");
                return new Declaration(nameOf(declaration), type, declaration.storage(), null);
            }

            private static CType stripConst(final CType type) {
                if (!(type instanceof QualifiedType qualified) || !qualified.has(Qualifier.CONST))
                    return type;
                final var remaining = EnumSet.noneOf(Qualifier.class);
                remaining.addAll(qualified.qualifiers());
                remaining.remove(Qualifier.CONST);
                return remaining.isEmpty() ? qualified.type() : new QualifiedType(remaining, qualified.type());
            }

            /**
             * Returns a copy of the passed type with contested names replaced.
             */
            private CType copyType(final CType type) {
                return Trees.copy(transformType(type));
            }

            /**
             * Returns the type naming the passed one in a compound literal, which must not define an aggregate again.
             */
            private CType literalType(final CType type) {
                final var unqualified = Trees.unqualified(copyType(type));
                return (unqualified instanceof StructType struct && struct.isDefinition() && struct.tag() != null)
                    ? new StructType(struct.union(), struct.tag(), null) : unqualified;
            }

            private static boolean isAnonymousAggregate(final CType type) {
                return Trees.unqualified(type) instanceof StructType struct && struct.tag() == null;
            }

            /**
             * Returns the string literal initializing an array declared by the passed declaration, if any.
             */
            private @Nullable StringLiteral stringInitializer(final Declaration declaration) {
                if (!(expressions.getTypes().resolveUnqualified(declaration.type()) instanceof ArrayType))
                    return null;
                final var initializer = declaration.initializer();
                if (initializer instanceof StringLiteral literal)
                    return literal;
                if (initializer instanceof InitializerList list && list.items().size() == 1
                        && list.items().get(0) instanceof StringLiteral literal)
                    return literal;
                return null;
            }

            private static List<CharacterConstant> characters(final Declaration declaration,
                                                              final StringLiteral literal) {
                try {
                    return Trees.characters(literal);
                } catch (final IllegalArgumentException exception) {
                    throw new PreconditionViolationException("Cannot hoist array '" + declaration.name()
                        + "' initialized by " + literal.text());
                }
            }
            //endregion

            //region Rewriting the body
            /**
             * Returns the statements replacing a local declaration at its original position.
             */
            private List<BlockItem> initialization(final Declaration declaration) {
                if (!isAutomatic(declaration))
                    return List.of();

                final var name = nameOf(declaration);
                if (variableLengthArrays.contains(scopes.bindingOf(declaration))) {
                    final var array = (ArrayType) declaration.type();
                    final var size = Trees.binary(BinaryOperator.MULTIPLY,
                        new SizeofTypeExpression(copyType(array.element())), transformExpression(array.size()));
                    return List.of(Trees.statement(Trees.assign(Trees.identifier(name),
                        new CallExpression(Trees.identifier("__builtin_alloca"), List.of(size)))));
                }

                final var initializer = declaration.initializer();
                if (initializer == null)
                    return List.of();

                final var types = expressions.getTypes();
                final var type  = types.resolveUnqualified(declaration.type());
                final var literal = stringInitializer(declaration);
                if (literal != null)
                    return characterAssignments(declaration, name, (ArrayType) type, literal);
                if (initializer instanceof Expression expression) {
                    if (type instanceof ArrayType)
                        throw new PreconditionViolationException("Cannot hoist array '" + declaration.name()
                            + "' initialized by " + expression);
                    return List.of(Trees.statement(Trees.assign(Trees.identifier(name),
                        transformExpression(expression))));
                }

                final var list = (InitializerList) initializer;
                if (type instanceof ArrayType array)
                    return elementAssignments(declaration, name, array, list);
                if (type instanceof StructType) {
                    if (isAnonymousAggregate(declaration.type()))
                        throw new PreconditionViolationException("Cannot hoist '" + declaration.name()
                            + "' of anonymous aggregate type");
                    return List.of(Trees.statement(Trees.assign(Trees.identifier(name),
                        new CompoundLiteral(literalType(declaration.type()), transformInitializerList(list)))));
                }
                return List.of(Trees.statement(Trees.assign(Trees.identifier(name), scalar(declaration, list))));
            }

            private Expression scalar(final Declaration declaration, final InitializerList list) {
                if (list.items().size() != 1 || !(list.items().get(0) instanceof Expression expression))
                    throw new PreconditionViolationException("Malformed initializer of '" + declaration.name() + "'");
                return transformExpression(expression);
            }

            private List<BlockItem> elementAssignments(final Declaration declaration, final String name,
                                                       final ArrayType array, final InitializerList list) {
                final var types   = expressions.getTypes();
                final var element = types.resolveUnqualified(array.element());
                if (element instanceof ArrayType)
                    throw new PreconditionViolationException("Cannot hoist initializer of multi-dimensional array '"
                        + declaration.name() + "'");
                if (element instanceof StructType && isAnonymousAggregate(array.element()))
                    throw new PreconditionViolationException("Cannot hoist '" + declaration.name()
                        + "' of anonymous aggregate type");

                final long length = length(declaration, array, list.items().size());
                if (length < list.items().size())
                    throw new PreconditionViolationException("Excess elements in initializer of '"
                        + declaration.name() + "'");

                final var assignments = new ArrayList<BlockItem>();
                for (int index = 0; index < length; index++) {
                    final Expression value;
                    if (index >= list.items().size())
                        value = (element instanceof StructType)
                            ? new CompoundLiteral(literalType(array.element()),
                                new InitializerList(List.of(Trees.integer(0))))
                            : Trees.integer(0);
                    else {
                        final Initializer item = list.items().get(index);
                        if (item instanceof DesignatedInitializer)
                            throw new PreconditionViolationException("Cannot hoist designated initializer of '"
                                + declaration.name() + "'");
                        if (item instanceof Expression expression)
                            value = transformExpression(expression);
                        else if (element instanceof StructType)
                            value = new CompoundLiteral(literalType(array.element()),
                                transformInitializerList((InitializerList) item));
                        else
                            value = scalar(declaration, (InitializerList) item);
                    }
                    assignments.add(Trees.statement(Trees.assign(
                        new SubscriptExpression(Trees.identifier(name), Trees.integer(index)), value)));
                }
                return assignments;
            }

            /**
             * Assigns each character of the literal, followed by null characters up to the length of the array.
             */
            private List<BlockItem> characterAssignments(final Declaration declaration, final String name,
                                                         final ArrayType array, final StringLiteral literal) {
                final var characters = characters(declaration, literal);
                final long length = length(declaration, array, characters.size() + 1);

                final var assignments = new ArrayList<BlockItem>();
                for (int index = 0; index < length; index++)
                    assignments.add(Trees.statement(Trees.assign(
                        new SubscriptExpression(Trees.identifier(name), Trees.integer(index)),
                        (index < characters.size()) ? characters.get(index) : Trees.integer(0))));
                return assignments;
            }

            /**
             * Returns the number of elements of the passed array, given the number of initialized elements.
             */
            private static long length(final Declaration declaration, final ArrayType array, final int initialized) {
                if (array.size() == null)
                    return initialized;
                if (array.size() instanceof IntegerConstant constant)
                    return constant.value();
                throw new PreconditionViolationException("Cannot determine length of array '"
                    + declaration.name() + "'");
            }

            @Override
            public List<BlockItem> transformBlockItem(final BlockItem item) {
                if (item instanceof Declaration declaration)
                    return initialization(declaration);
                if (item instanceof TypedefDeclaration || item instanceof TagDeclaration)
                    return List.of();
                return super.transformBlockItem(item);
            }

            @Override
            public Statement transformForStatement(final ForStatement statement) {
                if (statement.declarations().isEmpty())
                    return super.transformForStatement(statement);

                final var initializers = new ArrayList<Expression>();
                for (final var declaration : statement.declarations())
                    for (final var item : initialization(declaration))
                        initializers.add(((ExpressionStatement) item).expression());
                final Expression initializer;
                if (initializers.isEmpty())
                    initializer = null;
                else if (initializers.size() == 1)
                    initializer = initializers.get(0);
                else
                    initializer = new CommaExpression(initializers);
                return new ForStatement(List.of(), initializer,
                    (statement.condition() == null) ? null : transformExpression(statement.condition()),
                    (statement.step() == null) ? null : transformExpression(statement.step()),
                    transformStatement(statement.body()));
            }

            @Override
            public Expression transformIdentifier(final Identifier identifier) {
                final var name = nameOf(identifier, identifier.name());
                return name.equals(identifier.name()) ? identifier : Trees.identifier(name);
            }

            @Override
            public TypedefDeclaration transformTypedefDeclaration(final TypedefDeclaration typedef) {
                final var transformed = super.transformTypedefDeclaration(typedef);
                final var name = nameOf(typedef, typedef.name());
                return name.equals(typedef.name()) ? transformed : new TypedefDeclaration(name, transformed.type());
            }

            @Override
            public CType transformTypedefName(final TypedefName typedefName) {
                final var name = nameOf(typedefName, typedefName.name());
                return name.equals(typedefName.name()) ? typedefName : new TypedefName(name);
            }

            @Override
            public CType transformStructType(final StructType struct) {
                final var transformed = (StructType) super.transformStructType(struct);
                if (struct.tag() == null)
                    return transformed;
                final var tag = nameOf(struct, struct.tag());
                return tag.equals(struct.tag()) ? transformed
                    : new StructType(transformed.union(), tag, transformed.members());
            }

            @Override
            public CType transformEnumType(final EnumType enumType) {
                final var transformed = (EnumType) super.transformEnumType(enumType);
                if (enumType.tag() == null)
                    return transformed;
                final var tag = nameOf(enumType, enumType.tag());
                return tag.equals(enumType.tag()) ? transformed : new EnumType(tag, transformed.enumerators());
            }

            @Override
            public Enumerator transformEnumerator(final Enumerator enumerator) {
                final var transformed = super.transformEnumerator(enumerator);
                final var name = nameOf(enumerator, enumerator.name());
                return name.equals(enumerator.name()) ? transformed : new Enumerator(name, transformed.value());
            }

            @Override
            public Expression transformUnaryExpression(final UnaryExpression expression) {
                if ((expression.operator() == UnaryOperator.SIZEOF || expression.operator() == UnaryOperator.ADDRESS_OF)
                        && expression.operand() instanceof Identifier identifier
                        && variableLengthArrays.contains(scopes.bindingOf(identifier)))
                    throw new PreconditionViolationException("Cannot hoist variable length array '"
                        + identifier.name() + "' whose size or address is taken");
                return super.transformUnaryExpression(expression);
            }
            //endregion

            //region Dispatcher
            private List<BlockItem> dispatcher(final ControlFlowGraph graph, final List<BlockItem> hoisted) {
                final var items = new ArrayList<>(hoisted);
                final var labels = caseLabels(graph.blocks().size(), items);
                final var state = names.allocate("state");
                final var end = names.allocate("end");

                final var cases = new ArrayList<Statement>();
                for (final var block : graph.blocks())
                    cases.add(new CaseStatement(labels.get(block.id()).get(),
                        new CompoundStatement(caseBody(block, labels, state, end))));
                if (randomiseCases)
                    Collections.shuffle(cases, random);
                verify(cases, graph.blocks().size());

                items.add(new Declaration(state, PrimitiveType.of(Primitive.INT), labels.get(graph.entry().id()).get()));
                items.add(new WhileStatement(IntegerConstant.of(1), new CompoundStatement(
                    new SwitchStatement(Trees.identifier(state), Trees.compound(cases)))));
                if (fallsOffToEnd(graph))
                    items.add(new LabeledStatement(end, ExpressionStatement.empty()));
                return items;
            }

            private boolean isVoid() {
                return expressions.getTypes().resolveUnqualified(function.type().returnType())
                    instanceof PrimitiveType primitive && primitive.primitive() == Primitive.VOID;
            }

            private boolean fallsOffToEnd(final ControlFlowGraph graph) {
                if (isVoid() || function.name().equals("main"))
                    return false;
                for (final var block : graph.blocks())
                    if (block.terminator() instanceof Return returnTerminator && returnTerminator.implicit())
                        return true;
                return false;
            }

            /**
             * Creates the case label for each block. Enumerators are declared by an enumeration appended to
             * {@code items}.
             */
            private List<Supplier<Expression>> caseLabels(final int count,
                                                                               final List<BlockItem> items) {
                final var labels = new ArrayList<Supplier<Expression>>(count);
                if (caseStyle == CaseStyle.SEQUENTIAL) {
                    for (int id = 0; id < count; id++) {
                        final var value = id;
                        labels.add(() -> Trees.integer(value));
                    }
                    return labels;
                }

                final var values = new LinkedHashSet<Integer>();
                while (values.size() < count)
                    values.add(random.nextInt(Integer.MAX_VALUE));
                if (caseStyle == CaseStyle.RANDOM_INT) {
                    for (final var value : values)
                        labels.add(() -> Trees.integer(value));
                    return labels;
                }

                final var enumerators = new ArrayList<Enumerator>(count);
                for (final var value : values) {
                    final var name = names.allocate("S");
                    enumerators.add(new Enumerator(name, Trees.integer(value)));
                    labels.add(() -> Trees.identifier(name));
                }
                items.add(new TagDeclaration(new EnumType(null, enumerators)));
                return labels;
            }

            private List<BlockItem> caseBody(final BasicBlock block,
                                             final List<Supplier<Expression>> labels,
                                             final String state, final String end) {
                final var items = new ArrayList<BlockItem>(block.statements());
                final var terminator = block.terminator();
                if (terminator instanceof Fallthrough fallthrough)
                    items.addAll(transition(state, labels.get(fallthrough.target()).get()));
                else if (terminator instanceof Jump jump)
                    items.addAll(transition(state, labels.get(jump.target()).get()));
                else if (terminator instanceof Branch branch) {
                    items.add(new IfStatement(branch.condition(),
                        Trees.statement(Trees.assign(Trees.identifier(state), labels.get(branch.whenTrue()).get())),
                        Trees.statement(Trees.assign(Trees.identifier(state), labels.get(branch.whenFalse()).get()))));
                    items.add(new ContinueStatement());
                } else if (terminator instanceof SwitchDispatch dispatch) {
                    final var clauses = new ArrayList<BlockItem>();
                    for (final var switchCase : dispatch.cases())
                        clauses.add(new CaseStatement(switchCase.value(), new CompoundStatement(
                            Trees.statement(Trees.assign(Trees.identifier(state), labels.get(switchCase.target()).get())),
                            new BreakStatement())));
                    clauses.add(new DefaultStatement(new CompoundStatement(
                        Trees.statement(Trees.assign(Trees.identifier(state),
                            labels.get(dispatch.defaultTarget()).get())),
                        new BreakStatement())));
                    items.add(new SwitchStatement(dispatch.selector(), new CompoundStatement(clauses)));
                    items.add(new ContinueStatement());
                } else {
                    final var returnTerminator = (Return) terminator;
                    if (!returnTerminator.implicit())
                        items.add(new ReturnStatement(returnTerminator.value()));
                    else if (isVoid())
                        items.add(new ReturnStatement(null));
                    else if (function.name().equals("main"))
                        items.add(new ReturnStatement(Trees.integer(0)));
                    else
                        items.add(new GotoStatement(end));
                }
                return items;
            }

            private static List<BlockItem> transition(final String state, final Expression target) {
                return List.of(Trees.statement(Trees.assign(Trees.identifier(state), target)),
                    new ContinueStatement());
            }

            /**
             * Checks that the dispatcher has exactly one case per block and that no case declares anything.
             */
            private void verify(final List<Statement> cases, final int blockCount) {
                final var labels = new HashSet<Expression>();
                for (final var statement : cases) {
                    final var clause = (CaseStatement) statement;
                    labels.add(clause.value());
                    for (final var item : ((CompoundStatement) clause.body()).items())
                        if (!(item instanceof Statement))
                            throw new PreconditionViolationException("Declaration left in case of function '"
                                + function.name() + "'");
                }
                if (cases.size() != blockCount || labels.size() != blockCount)
                    throw new PreconditionViolationException("Case labels of function '" + function.name()
                        + "' are not distinct");
            }
            //endregion
        }
    }
}
