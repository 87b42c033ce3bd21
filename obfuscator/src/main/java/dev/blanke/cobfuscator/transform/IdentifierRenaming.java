package dev.blanke.cobfuscator.transform;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.NameGenerator;
import dev.blanke.cobfuscator.analysis.scope.NameSpace;
import dev.blanke.cobfuscator.analysis.scope.ScopeKind;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Designator;
import dev.blanke.cobfuscator.ast.EnumType;
import dev.blanke.cobfuscator.ast.Enumerator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.MemberDesignator;
import dev.blanke.cobfuscator.ast.MemberExpression;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.Parameter;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.TypedefDeclaration;
import dev.blanke.cobfuscator.ast.TypedefName;

/**
 * Replaces the names of variables, functions, typedefs, enumeration constants, tags, members and labels with the
 * shortest available identifiers.
 * <p>
 * Bindings are processed in the order of their declaration, each receiving the first generated name which none of
 * the bindings it {@linkplain dev.blanke.cobfuscator.analysis.scope.ScopeModel#conflicts(Binding, Binding) conflicts}
 * with carries already. By default, a name is additionally only reused by bindings whose liveness ranges are disjoint;
 * in minimising mode, names are reused as often as scoping permits.
 * <p>
 * Names which must be kept are {@code main}, those of entities declared but not defined in the translation unit, names
 * which could not be resolved, and members of aggregates which are accessed in a way the analysis could not follow.
 */
public final class IdentifierRenaming implements Transform {

    private static final Logger LOGGER = System.getLogger(IdentifierRenaming.class.getName());

    private final boolean minimiseIdentifiers;

    public IdentifierRenaming(final boolean minimiseIdentifiers) {
        this.minimiseIdentifiers = minimiseIdentifiers;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        return new RenamingTransformer(unit, random).transform();
    }

    private final class RenamingTransformer extends ObfuscatingTransformer {

        private final Map<Binding, String> names = new IdentityHashMap<>();

        RenamingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
            assignNames();
        }

        private boolean isRenamable(final Binding binding) {
            if (binding.getNameSpace() == NameSpace.MEMBER)
                return !expressions.getUnresolvedMemberNames().contains(binding.getName());
            if (binding.getKind() == BindingKind.FUNCTION && binding.getName().equals("main"))
                return false;
            // Entities with linkage which are defined elsewhere.
            return binding.getScope().getKind() != ScopeKind.FILE
                || binding.isDefined()
                || (binding.getKind() != BindingKind.FUNCTION && binding.getStorage() != StorageClass.EXTERN);
        }

        private void assignNames() {
            final var renamable = new ArrayList<Binding>();
            final var fixedNames = new HashSet<>(scopes.getUnresolvedNames());
            for (final var binding : scopes.getBindings()) {
                if (isRenamable(binding))
                    renamable.add(binding);
                else
                    fixedNames.add(binding.getName());
            }
            fixedNames.addAll(expressions.getUnresolvedMemberNames());

            final var holders = new HashMap<String, List<Binding>>();
            final var candidates = new ArrayList<String>();
            final var generator = new NameGenerator();
            for (final var binding : renamable) {
                String chosen = null;
                for (int i = 0; chosen == null; i++) {
                    if (i == candidates.size()) {
                        String candidate;
                        do {
                            candidate = generator.next();
                        } while (fixedNames.contains(candidate));
                        candidates.add(candidate);
                    }
                    final var candidate = candidates.get(i);
                    if (isCompatible(binding, holders.getOrDefault(candidate, List.of())))
                        chosen = candidate;
                }
                holders.computeIfAbsent(chosen, key -> new ArrayList<>()).add(binding);
                names.put(binding, chosen);
            }
            LOGGER.log(Level.DEBUG, "Renaming {0} bindings using {1} distinct names", names.size(),
                holders.size());
        }

        private boolean isCompatible(final Binding binding, final List<Binding> holders) {
            for (final var holder : holders) {
                if (scopes.conflicts(binding, holder))
                    return false;
                if (!minimiseIdentifiers && binding.getNameSpace() == holder.getNameSpace()
                        && binding.getLivenessRange().overlaps(holder.getLivenessRange()))
                    return false;
            }
            return true;
        }

        private String nameOf(final @Nullable Binding binding, final String name) {
            if (binding == null)
                return name;
            final var renamed = names.get(binding);
            return (renamed == null) ? name : renamed;
        }

        private String rename(final Node node, final String name) {
            return nameOf(scopes.bindingOf(node), name);
        }

        //region Declarations
        @Override
        public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
            final var transformed = super.transformFunctionDefinition(function);
            final var name = rename(function, function.name());
            return name.equals(function.name()) && transformed == function
                ? function : new FunctionDefinition(name, transformed.type(), transformed.storage(), transformed.body());
        }

        @Override
        public Declaration transformDeclaration(final Declaration declaration) {
            final var transformed = super.transformDeclaration(declaration);
            final var name = rename(declaration, declaration.name());
            return name.equals(declaration.name())
                ? transformed
                : new Declaration(name, transformed.type(), transformed.storage(), transformed.initializer());
        }

        @Override
        public Parameter transformParameter(final Parameter parameter) {
            final var transformed = super.transformParameter(parameter);
            if (parameter.name() == null)
                return transformed;
            final var name = rename(parameter, parameter.name());
            return name.equals(parameter.name()) ? transformed : new Parameter(name, transformed.type());
        }

        @Override
        public TypedefDeclaration transformTypedefDeclaration(final TypedefDeclaration typedef) {
            final var transformed = super.transformTypedefDeclaration(typedef);
            final var name = rename(typedef, typedef.name());
            return name.equals(typedef.name()) ? transformed : new TypedefDeclaration(name, transformed.type());
        }

        @Override
        public CType transformTypedefName(final TypedefName typedefName) {
            final var name = rename(typedefName, typedefName.name());
            return name.equals(typedefName.name()) ? typedefName : new TypedefName(name);
        }

        @Override
        public CType transformStructType(final StructType struct) {
            final var transformed = (StructType) super.transformStructType(struct);
            if (struct.tag() == null)
                return transformed;
            final var tag = rename(struct, struct.tag());
            return tag.equals(struct.tag()) ? transformed
                : new StructType(transformed.union(), tag, transformed.members());
        }

        @Override
        public CType transformEnumType(final EnumType enumType) {
            final var transformed = (EnumType) super.transformEnumType(enumType);
            if (enumType.tag() == null)
                return transformed;
            final var tag = rename(enumType, enumType.tag());
            return tag.equals(enumType.tag()) ? transformed : new EnumType(tag, transformed.enumerators());
        }

        @Override
        public Enumerator transformEnumerator(final Enumerator enumerator) {
            final var transformed = super.transformEnumerator(enumerator);
            final var name = rename(enumerator, enumerator.name());
            return name.equals(enumerator.name()) ? transformed : new Enumerator(name, transformed.value());
        }
        //endregion

        //region Uses
        @Override
        public Expression transformIdentifier(final Identifier identifier) {
            final var name = rename(identifier, identifier.name());
            return name.equals(identifier.name()) ? identifier : new Identifier(name);
        }

        @Override
        public Expression transformMemberExpression(final MemberExpression expression) {
            final var transformed = (MemberExpression) super.transformMemberExpression(expression);
            final var member = nameOf(expressions.memberBindingOf(expression), expression.member());
            return member.equals(expression.member())
                ? transformed : new MemberExpression(transformed.base(), member, transformed.arrow());
        }

        @Override
        public Designator transformDesignator(final Designator designator) {
            if (!(designator instanceof MemberDesignator member))
                return super.transformDesignator(designator);
            final var name = nameOf(expressions.memberBindingOf(member), member.name());
            return name.equals(member.name()) ? member : new MemberDesignator(name);
        }

        @Override
        public Statement transformLabeledStatement(final LabeledStatement statement) {
            final var transformed = (LabeledStatement) super.transformLabeledStatement(statement);
            final var label = rename(statement, statement.label());
            return label.equals(statement.label()) ? transformed : new LabeledStatement(label, transformed.body());
        }

        @Override
        public Statement transformGotoStatement(final GotoStatement statement) {
            final var label = rename(statement, statement.label());
            return label.equals(statement.label()) ? statement : new GotoStatement(label);
        }
        //endregion
    }
}
