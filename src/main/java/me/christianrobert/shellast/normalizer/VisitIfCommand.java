package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.IfCommand;
import me.christianrobert.shellast.foreign.ForeignNode;

/**
 * Static helper for if-statements.
 *
 * <p>The foreign parser already represents {@code elif} as a nested if-node in the false
 * branch, so no restructuring is needed here.
 */
public class VisitIfCommand {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        Command condition = b.visit(node.getChild(ForeignNode.ChildRole.TEST));
        Command thenBranch = b.visit(node.getChild(ForeignNode.ChildRole.TRUE_CASE));
        Command elseBranch = b.visitOptional(node.getChild(ForeignNode.ChildRole.FALSE_CASE));

        return new IfCommand(CommandTreeBuilder.lineOf(node), condition, thenBranch, elseBranch,
                ForeignLists.redirects(node.getRedirects(), b.getMaxListLength()));
    }
}
