package dev.blanke.cobfuscator.analysis.scope;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.EnumType;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.MemberDesignator;
import dev.blanke.cobfuscator.ast.MemberExpression;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.TagDeclaration;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.TypedefDeclaration;
import dev.blanke.cobfuscator.ast.TypedefName;
import dev.blanke.cobfuscator.ast.Trees;

/**
 * Builds the {@link ScopeModel} of a translation unit.
 * <p>
 * The tree is traversed depth-first in source order. A new scope is entered at each function definition, compound
 * statement, {@code for} header, prototype parameter list and member list, and left once its node has been visited.
 * Every event of the traversal (entering or leaving a scope, visiting a statement, expression or name) advances a
 * position counter, which orders all program points and yields the liveness ranges of bindings.
 * <p>
 * Names are resolved as the C compiler would resolve them: a declaration becomes visible right after its declarator,
 * and labels are visible throughout their function.
 */
public final class ScopeAnalyzer extends TreeVisitor {

    private static final Logger LOGGER = System.getLogger(ScopeAnalyzer.class.getName());

    private final List<Scope> scopes = new ArrayList<>();

    private final List<Binding> bindings = new ArrayList<>();

    /**
     * The bindings declared in each scope, keyed by namespace and name.
     */
    private final Map<Scope, Map<String, Binding>> declared = new IdentityHashMap<>();

    private final Map<Node, Binding> resolutions = new IdentityHashMap<>();

    private final Map<Node, ProgramPoint> points = new IdentityHashMap<>();

    private final Map<StructType, Scope> aggregateScopes = new IdentityHashMap<>();

    private final Map<FunctionDefinition, Scope> functionScopes = new IdentityHashMap<>();

    private final Set<String> unresolvedNames = new TreeSet<>();

    private final Set<String> memberNames = new TreeSet<>();

    /**
     * The innermost scope of the traversal. Together with the parent links of the scopes in the arena, it forms the
     * scope stack.
     */
    private @Nullable Scope current;

    private int position;

    /**
     * Set while visiting a declaration of the form {@code struct tag;}, which always declares a new tag in the current
     * scope, even if an outer scope declares the same tag.
     */
    private boolean forwardTagDeclaration;

    private ScopeAnalyzer() {
    }

    public static ScopeModel analyze(final SourceUnit unit) {
        final var analyzer = new ScopeAnalyzer();
        analyzer.openScope(ScopeKind.FILE);
        analyzer.visitSourceUnit(unit);
        analyzer.closeScope();

        LOGGER.log(Level.DEBUG, "Found {0} bindings in {1} scopes", analyzer.bindings.size(), analyzer.scopes.size());
        return new ScopeModel(analyzer.scopes, analyzer.bindings, analyzer.resolutions, analyzer.points,
            analyzer.aggregateScopes, analyzer.functionScopes, analyzer.unresolvedNames, analyzer.memberNames);
    }

    //region Scope stack
    private Scope currentScope() {
        if (current == null)
            throw new IllegalStateException("No scope has been entered");
        return current;
    }

    private Scope openScope(final ScopeKind kind) {
        final var scope = new Scope(scopes.size(), current, kind, ++position);
        scopes.add(scope);
        current = scope;
        return scope;
    }

    private void closeScope() {
        final var scope = currentScope();
        scope.close(++position);
        current = scope.getParent();
    }

    private ProgramPoint point() {
        return new ProgramPoint(currentScope(), ++position);
    }

    private static String key(final NameSpace nameSpace, final String name) {
        return nameSpace.name() + ':' + name;
    }

    private @Nullable Binding declaredIn(final Scope scope, final NameSpace nameSpace, final String name) {
        final var names = declared.get(scope);
        return (names == null) ? null : names.get(key(nameSpace, name));
    }

    private @Nullable Binding lookup(final String name, final NameSpace nameSpace) {
        if (nameSpace == NameSpace.LABEL) {
            final var function = ScopeModel.enclosingFunctionScope(currentScope());
            return (function == null) ? null : declaredIn(function, NameSpace.LABEL, name);
        }
        for (Scope scope = current; scope != null; scope = scope.getParent()) {
            final var binding = declaredIn(scope, nameSpace, name);
            if (binding != null)
                return binding;
        }
        return null;
    }
    //endregion

    //region Declaring and resolving names
    /**
     * Records a declaration of {@code name}. A redeclaration within the same scope refers to the already existing
     * binding, as does a block-scope declaration with linkage of an entity declared at file scope.
     */
    private Binding declare(final String        name,
                            final NameSpace     nameSpace,
                            final BindingKind   kind,
                            final @Nullable CType type,
                            final StorageClass  storage,
                            final Node          node,
                            final Scope         scope) {
        final var point = point();

        var binding = declaredIn(scope, nameSpace, name);
        if (binding == null && scope.getKind() != ScopeKind.FILE && nameSpace == NameSpace.ORDINARY
                && (kind == BindingKind.FUNCTION || storage == StorageClass.EXTERN)) {
            binding = declaredIn(scopes.get(0), nameSpace, name);
            if (binding != null)
                declared.computeIfAbsent(scope, key -> new HashMap<>()).put(key(nameSpace, name), binding);
        }

        if (binding == null) {
            binding = new Binding(bindings.size(), name, nameSpace, kind, scope, point.position(), type, storage, node);
            bindings.add(binding);
            declared.computeIfAbsent(scope, key -> new HashMap<>()).put(key(nameSpace, name), binding);
        } else if (binding.getStorage() == StorageClass.EXTERN && storage != StorageClass.EXTERN)
            binding.setStorage(storage);

        binding.addOccurrence(new Occurrence(node, point));
        resolutions.put(node, binding);
        return binding;
    }

    private void occur(final Binding binding, final Node node) {
        binding.addOccurrence(new Occurrence(node, point()));
        resolutions.put(node, binding);
    }

    private void resolve(final String name, final Node node) {
        final var binding = lookup(name, NameSpace.ORDINARY);
        if (binding != null)
            occur(binding, node);
        else
            unresolvedNames.add(name);
    }
    //endregion

    //region Declarations
    @Override
    public void visitFunctionDefinition(final FunctionDefinition definition) {
        final var function = declare(definition.name(), NameSpace.ORDINARY, BindingKind.FUNCTION, definition.type(),
            definition.storage(), definition, currentScope());
        function.define(definition, definition.type());

        visitType(definition.type().returnType());

        final var scope = openScope(ScopeKind.FUNCTION);
        functionScopes.put(definition, scope);
        points.put(definition.body(), point());

        for (final var labeled : labeledStatementsIn(definition.body())) {
            if (declaredIn(scope, NameSpace.LABEL, labeled.label()) != null)
                continue;
            final var label = new Binding(bindings.size(), labeled.label(), NameSpace.LABEL, BindingKind.LABEL, scope,
                scope.getStart(), null, StorageClass.NONE, labeled);
            label.define(labeled, null);
            bindings.add(label);
            declared.computeIfAbsent(scope, key -> new HashMap<>()).put(key(NameSpace.LABEL, labeled.label()), label);
        }
        for (final var parameter : definition.type().parameters()) {
            visitType(parameter.type());
            if (parameter.name() == null)
                continue;
            final var binding = declare(parameter.name(), NameSpace.ORDINARY, BindingKind.VARIABLE, parameter.type(),
                StorageClass.NONE, parameter, scope);
            binding.define(parameter, parameter.type());
            binding.markInitialized(binding.getDeclaredAt());
        }
        for (final var item : definition.body().items())
            visitBlockItem(item);
        closeScope();
    }

    private static List<LabeledStatement> labeledStatementsIn(final CompoundStatement body) {
        final var labeled = new ArrayList<LabeledStatement>();
        new TreeVisitor() {

            @Override
            public void visitLabeledStatement(final LabeledStatement statement) {
                labeled.add(statement);
                super.visitLabeledStatement(statement);
            }

            @Override
            public void visitExpression(final Expression expression) {
            }
        }.visitCompoundStatement(body);
        return labeled;
    }

    @Override
    public void visitDeclaration(final Declaration declaration) {
        points.put(declaration, point());
        visitType(declaration.type());

        final var kind = (Trees.unqualified(declaration.type()) instanceof FunctionType)
            ? BindingKind.FUNCTION : BindingKind.VARIABLE;
        final var binding = declare(declaration.name(), NameSpace.ORDINARY, kind, declaration.type(),
            declaration.storage(), declaration, currentScope().declaringScope());

        final var variable = kind == BindingKind.VARIABLE
            && (declaration.storage() != StorageClass.EXTERN || declaration.initializer() != null);
        if (variable) {
            binding.define(declaration, declaration.type());
            // Objects with static storage are zero-initialized before the program starts.
            if (binding.hasStaticStorage())
                binding.markInitialized(binding.getDeclaredAt());
        }
        if (declaration.initializer() != null) {
            visitInitializer(declaration.initializer());
            if (variable && !binding.isInitialized())
                binding.markInitialized(point().position());
        }
    }

    @Override
    public void visitTypedefDeclaration(final TypedefDeclaration typedef) {
        points.put(typedef, point());
        visitType(typedef.type());
        declare(typedef.name(), NameSpace.ORDINARY, BindingKind.TYPEDEF, typedef.type(), StorageClass.NONE, typedef,
            currentScope().declaringScope()).define(typedef, typedef.type());
    }

    @Override
    public void visitTagDeclaration(final TagDeclaration tag) {
        points.put(tag, point());
        forwardTagDeclaration = (tag.type() instanceof StructType struct) && !struct.isDefinition();
        visitType(tag.type());
        forwardTagDeclaration = false;
    }

    /**
     * Resolves or declares the tag of a structure, union or enumeration specifier.
     */
    private Binding tag(final String tag, final CType specifier, final boolean definition) {
        final var scope = currentScope().declaringScope();
        if (definition || forwardTagDeclaration) {
            forwardTagDeclaration = false;
            final var binding = declare(tag, NameSpace.TAG, BindingKind.TAG, specifier, StorageClass.NONE, specifier,
                scope);
            if (definition)
                binding.define(specifier, specifier);
            return binding;
        }
        final var binding = lookup(tag, NameSpace.TAG);
        if (binding == null)
            return declare(tag, NameSpace.TAG, BindingKind.TAG, specifier, StorageClass.NONE, specifier, scope);
        occur(binding, specifier);
        return binding;
    }

    @Override
    public void visitStructType(final StructType struct) {
        if (struct.tag() != null)
            tag(struct.tag(), struct, struct.isDefinition());
        if (struct.members() == null)
            return;

        final var aggregate = openScope(ScopeKind.AGGREGATE);
        aggregateScopes.put(struct, aggregate);
        for (final var member : struct.members()) {
            visitType(member.type());
            declare(member.name(), NameSpace.MEMBER, BindingKind.MEMBER, member.type(), StorageClass.NONE, member,
                aggregate).define(member, member.type());
        }
        closeScope();
    }

    @Override
    public void visitEnumType(final EnumType enumType) {
        if (enumType.tag() != null)
            tag(enumType.tag(), enumType, enumType.isDefinition());
        if (enumType.enumerators() == null)
            return;

        for (final var enumerator : enumType.enumerators()) {
            if (enumerator.value() != null)
                visitExpression(enumerator.value());
            declare(enumerator.name(), NameSpace.ORDINARY, BindingKind.ENUMERATOR, enumType, StorageClass.NONE,
                enumerator, currentScope().declaringScope()).define(enumerator, enumType);
        }
    }

    @Override
    public void visitFunctionType(final FunctionType function) {
        visitType(function.returnType());
        final var prototype = openScope(ScopeKind.PROTOTYPE);
        for (final var parameter : function.parameters()) {
            visitType(parameter.type());
            if (parameter.name() != null)
                declare(parameter.name(), NameSpace.ORDINARY, BindingKind.VARIABLE, parameter.type(),
                    StorageClass.NONE, parameter, prototype).define(parameter, parameter.type());
        }
        closeScope();
    }

    @Override
    public void visitTypedefName(final TypedefName typedefName) {
        resolve(typedefName.name(), typedefName);
    }
    //endregion

    //region Statements
    @Override
    public void visitStatement(final Statement statement) {
        points.put(statement, point());
        super.visitStatement(statement);
    }

    @Override
    public void visitCompoundStatement(final CompoundStatement compound) {
        openScope(ScopeKind.BLOCK);
        super.visitCompoundStatement(compound);
        closeScope();
    }

    @Override
    public void visitForStatement(final ForStatement statement) {
        openScope(ScopeKind.FOR);
        super.visitForStatement(statement);
        closeScope();
    }

    @Override
    public void visitLabeledStatement(final LabeledStatement statement) {
        final var label = lookup(statement.label(), NameSpace.LABEL);
        if (label != null)
            occur(label, statement);
        super.visitLabeledStatement(statement);
    }

    @Override
    public void visitGotoStatement(final GotoStatement statement) {
        final var label = lookup(statement.label(), NameSpace.LABEL);
        if (label != null)
            occur(label, statement);
    }
    //endregion

    //region Expressions
    @Override
    public void visitExpression(final Expression expression) {
        points.put(expression, point());
        super.visitExpression(expression);
    }

    @Override
    public void visitIdentifier(final Identifier identifier) {
        resolve(identifier.name(), identifier);
    }

    @Override
    public void visitMemberExpression(final MemberExpression expression) {
        memberNames.add(expression.member());
        super.visitMemberExpression(expression);
    }

    @Override
    public void visitMemberDesignator(final MemberDesignator designator) {
        memberNames.add(designator.name());
    }
    //endregion
}
