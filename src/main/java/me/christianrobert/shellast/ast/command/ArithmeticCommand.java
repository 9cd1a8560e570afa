package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * {@code (( EXPRESSION ))}. The expression is kept as raw text.
 */
public class ArithmeticCommand extends CompoundCommand {

    @JsonProperty("expression")
    private final String expression;

    @JsonCreator
    public ArithmeticCommand(@JsonProperty("line") Integer line,
                             @JsonProperty("expression") String expression,
                             @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        if (expression == null) {
            throw new IllegalArgumentException("Arithmetic expression cannot be null");
        }
        this.expression = expression;
    }

    public ArithmeticCommand(String expression) {
        this(null, expression, List.of());
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public List<Command> children() {
        return List.of();
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArithmeticCommand that = (ArithmeticCommand) o;
        return sameWrapper(that) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), expression, getRedirects());
    }

    @Override
    public String toString() {
        return "ArithmeticCommand{expression='" + expression + "'}";
    }
}
