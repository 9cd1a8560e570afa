package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.IfCommand;

/**
 * Static helper for if-statements.
 *
 * <p>A nested if-statement in the else-branch is written as {@code elif} as long as it has no
 * redirects of its own, so a chain prints with a single {@code fi}.
 */
public class WriteIf {

    public static String v(IfCommand command, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder();

        // STEP 1: if CONDITION; then BRANCH
        result.append("if ");
        appendBranch(command, result, b);

        // STEP 2: elif chain
        IfCommand current = command;
        while (current.hasElifBranch()) {
            current = (IfCommand) current.getElseBranch();
            result.append("elif ");
            appendBranch(current, result, b);
        }

        // STEP 3: else (optional)
        Command elseBranch = current.getElseBranch();
        if (elseBranch != null) {
            result.append("else ");
            result.append(b.visit(elseBranch));
            result.append(b.separator(elseBranch));
        }

        // STEP 4: fi and the outer redirects
        result.append("fi");
        result.append(b.redirects(command.getRedirects()));
        return result.toString();
    }

    private static void appendBranch(IfCommand command, StringBuilder result, ShellCodeBuilder b) {
        result.append(b.visit(command.getCondition()));
        result.append(b.separator(command.getCondition()));
        result.append("then ");
        result.append(b.visit(command.getThenBranch()));
        result.append(b.separator(command.getThenBranch()));
    }
}
