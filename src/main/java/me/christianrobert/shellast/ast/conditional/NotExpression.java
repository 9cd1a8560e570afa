package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Negation: {@code ! expr}.
 */
public class NotExpression extends ConditionalExpr {

    @JsonProperty("expr")
    private final ConditionalExpr expr;

    @JsonCreator
    public NotExpression(@JsonProperty("expr") ConditionalExpr expr) {
        this.expr = requireOperand(expr, "Expression");
    }

    public ConditionalExpr getExpr() {
        return expr;
    }

    @Override
    public <R> R accept(ConditionalExprVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass() == o.getClass() && expr.equals(((NotExpression) o).expr);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + expr.hashCode();
    }

    @Override
    public String toString() {
        return "NotExpression{expr=" + expr + "}";
    }
}
