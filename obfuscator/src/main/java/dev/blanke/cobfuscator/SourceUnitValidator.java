package dev.blanke.cobfuscator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import dev.blanke.cobfuscator.ast.BreakStatement;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.ContinueStatement;
import dev.blanke.cobfuscator.ast.DefaultStatement;
import dev.blanke.cobfuscator.ast.DoWhileStatement;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.SwitchStatement;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.WhileStatement;

/**
 * Rejects trees containing the jump and label errors a C compiler would reject, which every analysis assumes absent.
 */
public final class SourceUnitValidator {

    // Prevent instantiation of utility class.
    private SourceUnitValidator() {
    }

    /**
     * @throws MalformedTreeException If the unit defines a function twice, or if a function contains a misplaced
     *                                jump or {@code switch} label, or a duplicate or undefined label.
     */
    public static void validate(final SourceUnit unit) {
        final var functions = new HashSet<String>();
        for (final var declaration : unit.declarations()) {
            if (declaration instanceof FunctionDefinition function) {
                if (!functions.add(function.name()))
                    throw new MalformedTreeException("Redefinition of function '" + function.name() + "'");
                new FunctionValidator(function).validate();
            }
        }
    }

    private static final class FunctionValidator extends TreeVisitor {

        private final FunctionDefinition function;

        private final Set<String> labels = new HashSet<>();

        private final Set<String> targets = new TreeSet<>();

        /**
         * Whether a {@code default} label was seen, per enclosing {@code switch} statement.
         */
        private final Deque<boolean[]> switches = new ArrayDeque<>();

        private int loops;

        FunctionValidator(final FunctionDefinition function) {
            this.function = function;
        }

        void validate() {
            visitCompoundStatement(function.body());

            targets.removeAll(labels);
            if (!targets.isEmpty())
                throw malformed("Use of undefined label '" + targets.iterator().next() + "'");
        }

        private MalformedTreeException malformed(final String message) {
            return new MalformedTreeException(message + " in function '" + function.name() + "'");
        }

        //region Loops
        @Override
        public void visitWhileStatement(final WhileStatement statement) {
            ++loops;
            super.visitWhileStatement(statement);
            --loops;
        }

        @Override
        public void visitDoWhileStatement(final DoWhileStatement statement) {
            ++loops;
            super.visitDoWhileStatement(statement);
            --loops;
        }

        @Override
        public void visitForStatement(final ForStatement statement) {
            ++loops;
            super.visitForStatement(statement);
            --loops;
        }
        //endregion

        //region Switch statements
        @Override
        public void visitSwitchStatement(final SwitchStatement statement) {
            // Loops outside of the switch statement remain targets of continue.
            switches.push(new boolean[1]);
            super.visitSwitchStatement(statement);
            switches.pop();
        }

        @Override
        public void visitCaseStatement(final CaseStatement statement) {
            if (switches.isEmpty())
                throw malformed("'case' label not within a switch statement");
            super.visitCaseStatement(statement);
        }

        @Override
        public void visitDefaultStatement(final DefaultStatement statement) {
            if (switches.isEmpty())
                throw malformed("'default' label not within a switch statement");

            final var seen = switches.peek();
            if (seen[0])
                throw malformed("Multiple default labels in one switch");
            seen[0] = true;
            super.visitDefaultStatement(statement);
        }
        //endregion

        @Override
        public void visitBreakStatement(final BreakStatement statement) {
            if (loops == 0 && switches.isEmpty())
                throw malformed("'break' statement not within loop or switch");
        }

        @Override
        public void visitContinueStatement(final ContinueStatement statement) {
            if (loops == 0)
                throw malformed("'continue' statement not within a loop");
        }

        @Override
        public void visitLabeledStatement(final LabeledStatement statement) {
            if (!labels.add(statement.label()))
                throw malformed("Duplicate label '" + statement.label() + "'");
            super.visitLabeledStatement(statement);
        }

        @Override
        public void visitGotoStatement(final GotoStatement statement) {
            targets.add(statement.label());
        }
    }
}
