package me.christianrobert.shellast.ast.conditional;

/**
 * Visitor over {@link ConditionalExpr} node kinds.
 *
 * @param <R> result type
 */
public interface ConditionalExprVisitor<R> {

    R visitUnary(UnaryTest expr);

    R visitBinary(BinaryTest expr);

    R visitAnd(AndExpression expr);

    R visitOr(OrExpression expr);

    R visitNot(NotExpression expr);

    R visitTerm(TermExpression expr);

    R visitGrouped(GroupedExpression expr);
}
