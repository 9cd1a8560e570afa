package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.SubshellCommand;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ForeignNodeKind;

import java.util.List;

/**
 * Static helper for {@code { ...; }} groups and {@code ( ... )} subshells.
 */
public class VisitGroupingCommand {

    public static Command v(ForeignNodeKind kind, ForeignNode node, CommandTreeBuilder b) {
        Command body = b.visit(node.getChild(ForeignNode.ChildRole.BODY));
        List<Redirect> redirects = ForeignLists.redirects(node.getRedirects(), b.getMaxListLength());

        Integer line = CommandTreeBuilder.lineOf(node);
        if (kind == ForeignNodeKind.SUBSHELL) {
            return new SubshellCommand(line, body, redirects);
        }
        return new GroupCommand(line, body, redirects);
    }
}
