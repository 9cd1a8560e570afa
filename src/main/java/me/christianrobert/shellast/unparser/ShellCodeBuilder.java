package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.command.ArithmeticCommand;
import me.christianrobert.shellast.ast.command.ArithmeticForCommand;
import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.command.ConditionalCommand;
import me.christianrobert.shellast.ast.command.CoprocCommand;
import me.christianrobert.shellast.ast.command.ForCommand;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.IfCommand;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.command.SelectCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.command.SubshellCommand;
import me.christianrobert.shellast.ast.command.UntilCommand;
import me.christianrobert.shellast.ast.command.WhileCommand;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that writes a command tree as shell text.
 *
 * <p>Each visit method returns the text of one node; the static {@code WriteXxx.v(cmd, b)}
 * helpers do the per-construct layout and call back into {@link #visit(Command)} for children.
 *
 * <p>Here-document bodies cannot be written where their {@code <<DELIM} marker appears. Markers
 * register their redirect as pending, and every point where a new line may start
 * ({@link #separator(Command)}, {@link #closer()}) writes the pending bodies first.
 * Text must therefore be produced strictly left to right.
 *
 * <p>One builder per serialization; not thread-safe.
 */
public class ShellCodeBuilder implements CommandVisitor<String> {

    // no logging is desired, this runs for every node

    static final String DEFAULT_HEREDOC_DELIMITER = "EOF";

    private final List<Redirect> pendingHereDocs = new ArrayList<>();

    public String visit(Command command) {
        return command.accept(this);
    }

    // ========== HERE-DOCUMENTS ==========

    void addPendingHereDoc(Redirect redirect) {
        pendingHereDocs.add(redirect);
    }

    boolean hasPendingHereDocs() {
        return !pendingHereDocs.isEmpty();
    }

    /**
     * Writes all pending here-document bodies, each followed by its delimiter line, and clears
     * the pending list. The result starts with a newline and does not end with one. An empty
     * body puts the delimiter directly on the next line.
     */
    String flushHereDocs() {
        if (pendingHereDocs.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Redirect hereDoc : pendingHereDocs) {
            String body = hereDoc.getTarget() instanceof RedirectTarget.File
                    ? ((RedirectTarget.File) hereDoc.getTarget()).getName()
                    : "";
            sb.append("\n").append(body);
            if (!body.isEmpty() && !body.endsWith("\n")) {
                sb.append("\n");
            }
            sb.append(delimiterOf(hereDoc));
        }
        pendingHereDocs.clear();
        return sb.toString();
    }

    static String delimiterOf(Redirect hereDoc) {
        return hereDoc.getHereDocDelimiter() != null ? hereDoc.getHereDocDelimiter() : DEFAULT_HEREDOC_DELIMITER;
    }

    // ========== SEPARATORS ==========

    /**
     * Text between a command and whatever follows it on the same construct
     * ({@code ; then}, {@code ; do}, the closing brace of a group, sequential lists).
     */
    String separator(Command preceding) {
        if (hasPendingHereDocs()) {
            return flushHereDocs() + "\n";
        }
        if (endsWithBackground(preceding)) {
            return " ";
        }
        return "; ";
    }

    /**
     * Text between a command and a token that terminates it by itself ({@code )} or a case
     * clause terminator).
     */
    String closer() {
        if (hasPendingHereDocs()) {
            return flushHereDocs() + "\n";
        }
        return " ";
    }

    /**
     * True when the text of {@code command} ends in a bare {@code &}, after which {@code ;}
     * would be a syntax error.
     */
    static boolean endsWithBackground(Command command) {
        if (!(command instanceof ListCommand)) {
            return false;
        }
        ListCommand list = (ListCommand) command;
        if (list.isTrailingBackground()) {
            return true;
        }
        if (list.getOp().isConditional()) {
            return false;
        }
        return endsWithBackground(list.getRight());
    }

    // ========== REDIRECTS ==========

    /**
     * Appends {@code " " + redirect} for each redirect, registering here-documents.
     */
    String redirects(List<Redirect> redirects) {
        StringBuilder sb = new StringBuilder();
        for (Redirect redirect : redirects) {
            sb.append(" ").append(WriteRedirect.v(redirect, this));
        }
        return sb.toString();
    }

    /**
     * Writes a command as {@code { cmd; }} so it binds as a single unit.
     */
    String grouped(Command command) {
        return "{ " + visit(command) + separator(command) + "}";
    }

    // ========== COMMANDS ==========

    @Override
    public String visitSimple(SimpleCommand command) {
        return WriteSimpleCommand.v(command, this);
    }

    @Override
    public String visitPipeline(PipelineCommand command) {
        return WriteList.pipeline(command, this);
    }

    @Override
    public String visitList(ListCommand command) {
        return WriteList.v(command, this);
    }

    @Override
    public String visitFor(ForCommand command) {
        return WriteLoop.iteration("for", command, this);
    }

    @Override
    public String visitSelect(SelectCommand command) {
        return WriteLoop.iteration("select", command, this);
    }

    @Override
    public String visitWhile(WhileCommand command) {
        return WriteLoop.testLoop(command, this);
    }

    @Override
    public String visitUntil(UntilCommand command) {
        return WriteLoop.testLoop(command, this);
    }

    @Override
    public String visitArithmeticFor(ArithmeticForCommand command) {
        return WriteLoop.arithmeticFor(command, this);
    }

    @Override
    public String visitIf(IfCommand command) {
        return WriteIf.v(command, this);
    }

    @Override
    public String visitCase(CaseCommand command) {
        return WriteCase.v(command, this);
    }

    @Override
    public String visitGroup(GroupCommand command) {
        return WriteGrouping.group(command, this);
    }

    @Override
    public String visitSubshell(SubshellCommand command) {
        return WriteGrouping.subshell(command, this);
    }

    @Override
    public String visitFunctionDef(FunctionDefCommand command) {
        return WriteGrouping.functionDef(command, this);
    }

    @Override
    public String visitCoproc(CoprocCommand command) {
        return WriteGrouping.coproc(command, this);
    }

    @Override
    public String visitArithmetic(ArithmeticCommand command) {
        return "((" + command.getExpression() + "))" + redirects(command.getRedirects());
    }

    @Override
    public String visitConditional(ConditionalCommand command) {
        return "[[ " + ConditionalExprWriter.write(command.getExpr()) + " ]]" + redirects(command.getRedirects());
    }
}
