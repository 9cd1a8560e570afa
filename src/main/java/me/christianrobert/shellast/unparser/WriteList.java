package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.element.ListOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lists and pipelines.
 *
 * <p>{@code &&} and {@code ||} bind tighter than {@code ;}, newline and {@code &}, and chains are
 * left-associative. Operands whose tree shape the text would not reproduce are written as
 * {@code { ...; }} groups.
 */
public class WriteList {

    public static String v(ListCommand list, ShellCodeBuilder b) {
        ListOp op = list.getOp();
        String left = operand(list.getLeft(), op, true, b);

        switch (op) {
            case AND:
            case OR:
                return left + " " + op.getSymbol() + " " + operand(list.getRight(), op, false, b);

            case BACKGROUND: {
                String text = left + " &";
                if (list.isTrailingBackground()) {
                    return text;
                }
                String joiner = b.hasPendingHereDocs() ? b.flushHereDocs() + "\n" : " ";
                return text + joiner + operand(list.getRight(), op, false, b);
            }

            case NEWLINE: {
                String joiner = b.hasPendingHereDocs() ? b.flushHereDocs() + "\n" : "\n";
                return left + joiner + operand(list.getRight(), op, false, b);
            }

            default:
                String separator = b.separator(list.getLeft());
                return left + separator + operand(list.getRight(), op, false, b);
        }
    }

    public static String pipeline(PipelineCommand pipeline, ShellCodeBuilder b) {
        List<String> stages = new ArrayList<>(pipeline.getCommands().size());
        for (Command stage : pipeline.getCommands()) {
            stages.add(stage instanceof ListCommand ? b.grouped(stage) : b.visit(stage));
        }
        String text = String.join(" | ", stages);
        return pipeline.isNegated() ? "! " + text : text;
    }

    private static String operand(Command operand, ListOp parent, boolean left, ShellCodeBuilder b) {
        if (needsGroup(operand, parent, left)) {
            return b.grouped(operand);
        }
        return b.visit(operand);
    }

    static boolean needsGroup(Command operand, ListOp parent, boolean left) {
        if (!(operand instanceof ListCommand)) {
            return false;
        }
        ListOp child = ((ListCommand) operand).getOp();
        if (parent.isConditional()) {
            // a; b && c  means  a; (b && c)  and  a && b || c  means  (a && b) || c
            return !left || !child.isConditional();
        }
        if (parent == ListOp.BACKGROUND && left) {
            // a; b &  backgrounds only b
            return !child.isConditional();
        }
        return false;
    }
}
