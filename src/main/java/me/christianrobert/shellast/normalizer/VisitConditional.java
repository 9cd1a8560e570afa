package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ConditionalCommand;
import me.christianrobert.shellast.ast.conditional.AndExpression;
import me.christianrobert.shellast.ast.conditional.BinaryTest;
import me.christianrobert.shellast.ast.conditional.ConditionalExpr;
import me.christianrobert.shellast.ast.conditional.GroupedExpression;
import me.christianrobert.shellast.ast.conditional.NotExpression;
import me.christianrobert.shellast.ast.conditional.OrExpression;
import me.christianrobert.shellast.ast.conditional.TermExpression;
import me.christianrobert.shellast.ast.conditional.UnaryTest;
import me.christianrobert.shellast.foreign.ForeignCondNode;
import me.christianrobert.shellast.foreign.ForeignFlags;
import me.christianrobert.shellast.foreign.ForeignNode;

/**
 * Static helper for {@code [[ ]]} commands.
 *
 * <p>Expression nodes count towards the same nesting depth as commands. A node carrying the
 * invert flag is wrapped in {@link NotExpression}. Missing operand words become empty strings.
 */
public class VisitConditional {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        ConditionalExpr expr = expression(node.getCondition(), b);
        return new ConditionalCommand(CommandTreeBuilder.lineOf(node), expr,
                ForeignLists.redirects(node.getRedirects(), b.getMaxListLength()));
    }

    static ConditionalExpr expression(ForeignCondNode cond, CommandTreeBuilder b) {
        if (cond == null) {
            throw new ConversionException("Missing conditional expression node");
        }
        try {
            b.enter();
            ConditionalExpr expr = build(cond, b);
            if (ForeignFlags.isSet(cond.getFlags(), ForeignFlags.CMD_INVERT_RETURN)) {
                return new NotExpression(expr);
            }
            return expr;
        } finally {
            b.leave();
        }
    }

    private static ConditionalExpr build(ForeignCondNode cond, CommandTreeBuilder b) {
        return switch (cond.getType()) {
            case ForeignFlags.COND_AND -> new AndExpression(
                    expression(cond.getLeft(), b), expression(cond.getRight(), b));
            case ForeignFlags.COND_OR -> new OrExpression(
                    expression(cond.getLeft(), b), expression(cond.getRight(), b));
            case ForeignFlags.COND_UNARY -> new UnaryTest(
                    ForeignLists.textOf(cond.getOp()), operandWord(cond.getLeft()));
            case ForeignFlags.COND_BINARY -> new BinaryTest(
                    ForeignLists.textOf(cond.getOp()), operandWord(cond.getLeft()), operandWord(cond.getRight()));
            case ForeignFlags.COND_TERM -> new TermExpression(ForeignLists.textOf(cond.getOp()));
            case ForeignFlags.COND_EXPR -> new GroupedExpression(expression(cond.getLeft(), b));
            default -> throw new ConversionException("Unrecognized conditional node type " + cond.getType(),
                    "COND", null);
        };
    }

    // Operands of unary and binary tests live in the op word of the child node
    private static String operandWord(ForeignCondNode child) {
        return child == null ? "" : ForeignLists.textOf(child.getOp());
    }
}
