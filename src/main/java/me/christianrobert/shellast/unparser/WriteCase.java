package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.element.CaseClause;

/**
 * Static helper for case statements:
 * {@code case WORD in a|b) ACTION ;; c) ACTION ;& esac}.
 */
public class WriteCase {

    public static String v(CaseCommand command, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        result.append("case ").append(command.getWord()).append(" in ");

        for (CaseClause clause : command.getClauses()) {
            result.append(String.join("|", clause.getPatterns())).append(") ");
            if (clause.getAction() != null) {
                result.append(b.visit(clause.getAction()));
                // Terminator ends the action itself, no ; needed
                result.append(b.closer());
            }
            result.append(clause.terminator()).append(" ");
        }

        result.append("esac");
        result.append(b.redirects(command.getRedirects()));
        return result.toString();
    }
}
