package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parenthesized sub-expression: {@code ( expr )}.
 */
public class GroupedExpression extends ConditionalExpr {

    @JsonProperty("expr")
    private final ConditionalExpr expr;

    @JsonCreator
    public GroupedExpression(@JsonProperty("expr") ConditionalExpr expr) {
        this.expr = requireOperand(expr, "Expression");
    }

    public ConditionalExpr getExpr() {
        return expr;
    }

    @Override
    public <R> R accept(ConditionalExprVisitor<R> visitor) {
        return visitor.visitGrouped(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass() == o.getClass() && expr.equals(((GroupedExpression) o).expr);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + expr.hashCode();
    }

    @Override
    public String toString() {
        return "GroupedExpression{expr=" + expr + "}";
    }
}
