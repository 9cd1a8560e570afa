package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.conditional.AndExpression;
import me.christianrobert.shellast.ast.conditional.BinaryTest;
import me.christianrobert.shellast.ast.conditional.ConditionalExpr;
import me.christianrobert.shellast.ast.conditional.ConditionalExprVisitor;
import me.christianrobert.shellast.ast.conditional.GroupedExpression;
import me.christianrobert.shellast.ast.conditional.NotExpression;
import me.christianrobert.shellast.ast.conditional.OrExpression;
import me.christianrobert.shellast.ast.conditional.TermExpression;
import me.christianrobert.shellast.ast.conditional.UnaryTest;

/**
 * Writes the inside of a {@code [[ ]]} expression.
 *
 * <p>Trees coming from the parser carry explicit {@link GroupedExpression} nodes, so they are
 * written as-is. Hand-built trees that rely on structure alone (an {@code ||} under an
 * {@code &&}, or a connective under {@code !}) get parentheses so the text parses back to the
 * same meaning.
 */
public class ConditionalExprWriter implements ConditionalExprVisitor<String> {

    private static final ConditionalExprWriter INSTANCE = new ConditionalExprWriter();

    public static String write(ConditionalExpr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitUnary(UnaryTest expr) {
        return expr.getOp() + " " + expr.getArg();
    }

    @Override
    public String visitBinary(BinaryTest expr) {
        return expr.getLeft() + " " + expr.getOp() + " " + expr.getRight();
    }

    @Override
    public String visitAnd(AndExpression expr) {
        return operandOfAnd(expr.getLeft()) + " && " + operandOfAnd(expr.getRight());
    }

    @Override
    public String visitOr(OrExpression expr) {
        return expr.getLeft().accept(this) + " || " + expr.getRight().accept(this);
    }

    @Override
    public String visitNot(NotExpression expr) {
        ConditionalExpr inner = expr.getExpr();
        if (inner instanceof AndExpression || inner instanceof OrExpression) {
            return "! " + parenthesize(inner);
        }
        return "! " + inner.accept(this);
    }

    @Override
    public String visitTerm(TermExpression expr) {
        return expr.getWord();
    }

    @Override
    public String visitGrouped(GroupedExpression expr) {
        return parenthesize(expr.getExpr());
    }

    private String operandOfAnd(ConditionalExpr operand) {
        if (operand instanceof OrExpression) {
            return parenthesize(operand);
        }
        return operand.accept(this);
    }

    private String parenthesize(ConditionalExpr expr) {
        return "( " + expr.accept(this) + " )";
    }
}
