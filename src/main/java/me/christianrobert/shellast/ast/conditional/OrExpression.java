package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * {@code left || right}
 */
public class OrExpression extends ConditionalExpr {

    @JsonProperty("left")
    private final ConditionalExpr left;

    @JsonProperty("right")
    private final ConditionalExpr right;

    @JsonCreator
    public OrExpression(@JsonProperty("left") ConditionalExpr left,
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
        return visitor.visitOr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrExpression that = (OrExpression) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "OrExpression{left=" + left + ", right=" + right + "}";
    }
}
