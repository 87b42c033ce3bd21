package dev.blanke.cobfuscator.analysis.expression;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Set;

import dev.blanke.cobfuscator.analysis.scope.Binding;
import dev.blanke.cobfuscator.analysis.scope.BindingKind;
import dev.blanke.cobfuscator.analysis.scope.ScopeModel;
import dev.blanke.cobfuscator.ast.AssignmentExpression;
import dev.blanke.cobfuscator.ast.CallExpression;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.MemberExpression;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.SubscriptExpression;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;

/**
 * Determines the functions of a translation unit whose calls are {@link Effect#PURE}: they neither access objects
 * other than their own automatic variables nor call functions which are not pure themselves.
 * <p>
 * Every defined function starts out as a candidate if its body is pure when calls are disregarded. Candidates calling
 * a function which is not a candidate are then removed until no more candidates change.
 */
final class PurityAnalysis {

    // Prevent instantiation of utility class.
    private PurityAnalysis() {
    }

    static Set<String> pureFunctions(final SourceUnit unit, final ScopeModel model) {
        final var callees = new LinkedHashMap<String, Set<String>>();
        for (final var declaration : unit.declarations())
            if (declaration instanceof FunctionDefinition function && !function.type().variadic()) {
                final var checker = new LocalPurityChecker(model);
                checker.visitCompoundStatement(function.body());
                if (checker.pure)
                    callees.put(function.name(), checker.callees);
            }

        boolean changed;
        do {
            changed = callees.keySet().removeIf(name -> !callees.keySet().containsAll(callees.get(name)));
        } while (changed);
        return Set.copyOf(callees.keySet());
    }

    private static final class LocalPurityChecker extends TreeVisitor {

        private final ScopeModel model;

        private final Set<String> callees = new HashSet<>();

        private boolean pure = true;

        LocalPurityChecker(final ScopeModel model) {
            this.model = model;
        }

        private boolean isOwnVariable(final Expression expression) {
            if (!(expression instanceof Identifier identifier))
                return false;
            final var binding = model.bindingOf(identifier);
            return binding != null && binding.isAutomatic()
                && !Trees.isQualified(binding.getType(), Qualifier.VOLATILE);
        }

        @Override
        public void visitDeclaration(final Declaration declaration) {
            if (declaration.storage() == StorageClass.STATIC || declaration.storage() == StorageClass.EXTERN)
                pure = false;
            super.visitDeclaration(declaration);
        }

        @Override
        public void visitIdentifier(final Identifier identifier) {
            final Binding binding = model.bindingOf(identifier);
            if (binding == null
                    || (binding.getKind() == BindingKind.VARIABLE && !isOwnVariable(identifier)))
                pure = false;
        }

        @Override
        public void visitUnaryExpression(final UnaryExpression expression) {
            if (expression.operator() == UnaryOperator.DEREFERENCE || expression.operator() == UnaryOperator.ADDRESS_OF
                    || (expression.operator().isModifying() && !isOwnVariable(expression.operand())))
                pure = false;
            super.visitUnaryExpression(expression);
        }

        @Override
        public void visitAssignmentExpression(final AssignmentExpression expression) {
            if (!isOwnVariable(expression.target()))
                pure = false;
            super.visitAssignmentExpression(expression);
        }

        @Override
        public void visitSubscriptExpression(final SubscriptExpression expression) {
            pure = false;
        }

        @Override
        public void visitMemberExpression(final MemberExpression expression) {
            if (expression.arrow())
                pure = false;
            super.visitMemberExpression(expression);
        }

        @Override
        public void visitCallExpression(final CallExpression expression) {
            final var callee = (expression.callee() instanceof Identifier identifier)
                ? model.bindingOf(identifier) : null;
            if (callee == null || callee.getKind() != BindingKind.FUNCTION)
                pure = false;
            else
                callees.add(callee.getName());
            for (final var argument : expression.arguments())
                visitExpression(argument);
        }
    }
}
