package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Unary test such as {@code -f file} or {@code -z "$x"}.
 */
public class UnaryTest extends ConditionalExpr {

    @JsonProperty("op")
    private final String op;

    @JsonProperty("arg")
    private final String arg;

    @JsonCreator
    public UnaryTest(@JsonProperty("op") String op, @JsonProperty("arg") String arg) {
        this.op = requireText(op, "Unary operator");
        this.arg = requireText(arg, "Unary argument");
    }

    public String getOp() {
        return op;
    }

    public String getArg() {
        return arg;
    }

    @Override
    public <R> R accept(ConditionalExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryTest that = (UnaryTest) o;
        return op.equals(that.op) && arg.equals(that.arg);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, arg);
    }

    @Override
    public String toString() {
        return "UnaryTest{op='" + op + "', arg='" + arg + "'}";
    }
}
