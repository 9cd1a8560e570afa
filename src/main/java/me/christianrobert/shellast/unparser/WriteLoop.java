package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.command.ArithmeticForCommand;
import me.christianrobert.shellast.ast.command.TestLoopCommand;
import me.christianrobert.shellast.ast.command.WordIterationCommand;

/**
 * Static helper for loops.
 *
 * <pre>
 * for v in a b; do BODY; done      (for v; do ... when there is no word list)
 * select v in a b; do BODY; done
 * while TEST; do BODY; done
 * for ((i = 0; i &lt; 3; i++)); do BODY; done
 * </pre>
 */
public class WriteLoop {

    public static String iteration(String keyword, WordIterationCommand loop, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        result.append(keyword).append(" ").append(loop.getVariable());

        if (!loop.iteratesPositionalParameters()) {
            result.append(" in");
            if (loop.getWords().isEmpty()) {
                result.append(" ");
            } else {
                result.append(" ").append(String.join(" ", loop.getWords()));
            }
        }
        result.append("; do ");
        result.append(b.visit(loop.getBody()));
        result.append(b.separator(loop.getBody()));
        result.append("done");
        result.append(b.redirects(loop.getRedirects()));
        return result.toString();
    }

    public static String testLoop(TestLoopCommand loop, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        result.append(loop.keyword()).append(" ");
        result.append(b.visit(loop.getTest()));
        result.append(b.separator(loop.getTest()));
        result.append("do ");
        result.append(b.visit(loop.getBody()));
        result.append(b.separator(loop.getBody()));
        result.append("done");
        result.append(b.redirects(loop.getRedirects()));
        return result.toString();
    }

    public static String arithmeticFor(ArithmeticForCommand loop, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        result.append("for ((")
                .append(loop.getInit()).append("; ")
                .append(loop.getTest()).append("; ")
                .append(loop.getStep()).append(")); do ");
        result.append(b.visit(loop.getBody()));
        result.append(b.separator(loop.getBody()));
        result.append("done");
        result.append(b.redirects(loop.getRedirects()));
        return result.toString();
    }
}
