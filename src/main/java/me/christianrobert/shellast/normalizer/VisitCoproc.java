package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.CoprocCommand;
import me.christianrobert.shellast.foreign.ForeignNode;

/**
 * Static helper for coprocesses.
 */
public class VisitCoproc {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        Command body = b.visit(node.getChild(ForeignNode.ChildRole.BODY));
        return new CoprocCommand(CommandTreeBuilder.lineOf(node), node.getText(ForeignNode.TextRole.NAME), body);
    }
}
