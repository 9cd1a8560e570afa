package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.element.ListOp;
import me.christianrobert.shellast.foreign.ForeignFlags;
import me.christianrobert.shellast.foreign.ForeignNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for converting connection nodes: pipelines and lists.
 *
 * <p>Connection nodes never carry a line; their children do.
 */
public class VisitConnection {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        int connector = node.getConnector();
        if (connector == ForeignFlags.CONNECTOR_PIPE) {
            return pipeline(node, b);
        }
        return list(node, listOp(connector), b);
    }

    /**
     * Maps a connector token to a list operator. The multi-character tokens are matched on
     * their full value, never on their low byte.
     */
    static ListOp listOp(int connector) {
        if (connector == ForeignFlags.AND_AND || connector == ForeignFlags.AND_AND_PACKED) {
            return ListOp.AND;
        }
        if (connector == ForeignFlags.OR_OR || connector == ForeignFlags.OR_OR_PACKED) {
            return ListOp.OR;
        }
        return switch (connector) {
            case ForeignFlags.CONNECTOR_BACKGROUND -> ListOp.BACKGROUND;
            case ForeignFlags.CONNECTOR_NEWLINE -> ListOp.NEWLINE;
            default -> ListOp.SEMICOLON;
        };
    }

    private static Command pipeline(ForeignNode node, CommandTreeBuilder b) {
        List<Command> stages = new ArrayList<>();
        addStages(b.visit(node.getChild(ForeignNode.ChildRole.FIRST)), stages);
        addStages(b.visit(node.getChild(ForeignNode.ChildRole.SECOND)), stages);

        boolean negated = ForeignFlags.isSet(node.getFlags(), ForeignFlags.CMD_INVERT_RETURN);
        return new PipelineCommand(null, stages, negated);
    }

    private static void addStages(Command command, List<Command> stages) {
        if (command instanceof PipelineCommand) {
            PipelineCommand inner = (PipelineCommand) command;
            if (inner.isNegated()) {
                throw new ConversionException("Negated pipeline cannot be a pipeline stage", "connection", null);
            }
            stages.addAll(inner.getCommands());
        } else {
            stages.add(command);
        }
    }

    private static Command list(ForeignNode node, ListOp op, CommandTreeBuilder b) {
        Command left = b.visit(node.getChild(ForeignNode.ChildRole.FIRST));

        ForeignNode second = node.getChild(ForeignNode.ChildRole.SECOND);
        Command right;
        if (second != null) {
            right = b.visit(second);
        } else if (op == ListOp.BACKGROUND) {
            // cmd & with nothing after it
            right = SimpleCommand.emptyPlaceholder();
        } else {
            throw new ConversionException("List operator " + op + " is missing its right operand", "connection", null);
        }

        return new ListCommand(null, op, left, right);
    }
}
