package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.UntilCommand;
import me.christianrobert.shellast.ast.command.WhileCommand;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ForeignNodeKind;

import java.util.List;

/**
 * Static helper for while and until loops. Both share one foreign shape.
 */
public class VisitTestLoop {

    public static Command v(ForeignNodeKind kind, ForeignNode node, CommandTreeBuilder b) {
        Command test = b.visit(node.getChild(ForeignNode.ChildRole.TEST));
        Command body = b.visit(node.getChild(ForeignNode.ChildRole.ACTION));
        List<Redirect> redirects = ForeignLists.redirects(node.getRedirects(), b.getMaxListLength());

        Integer line = CommandTreeBuilder.lineOf(node);
        if (kind == ForeignNodeKind.UNTIL) {
            return new UntilCommand(line, test, body, redirects);
        }
        return new WhileCommand(line, test, body, redirects);
    }
}
