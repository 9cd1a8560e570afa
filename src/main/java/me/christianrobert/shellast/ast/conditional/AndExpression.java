package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * {@code left && right}
 */
public class AndExpression extends ConditionalExpr {

    @JsonProperty("left")
    private final ConditionalExpr left;

    @JsonProperty("right")
    private final ConditionalExpr right;

    @JsonCreator
    public AndExpression(@JsonProperty("left") ConditionalExpr left,
                         @JsonProperty("right") ConditionalExpr right) {
        this.left = requireOperand(left, "Left operand");
        this.right = requireOperand(right, "Right operand");
    }

    public ConditionalExpr getLeft() {
        return left;
    }

    public ConditionalExpr getRight() {
        return right;
    }

    @Override
    public <R> R accept(ConditionalExprVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AndExpression that = (AndExpression) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "AndExpression{left=" + left + ", right=" + right + "}";
    }
}
