package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.conditional.ConditionalExpr;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * {@code [[ EXPR ]]}
 */
public class ConditionalCommand extends CompoundCommand {

    @JsonProperty("expr")
    private final ConditionalExpr expr;

    @JsonCreator
    public ConditionalCommand(@JsonProperty("line") Integer line,
                              @JsonProperty("expr") ConditionalExpr expr,
                              @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        if (expr == null) {
            throw new IllegalArgumentException("Conditional expression cannot be null");
        }
        this.expr = expr;
    }

    public ConditionalCommand(ConditionalExpr expr) {
        this(null, expr, List.of());
    }

    public ConditionalExpr getExpr() {
        return expr;
    }

    @Override
    public List<Command> children() {
        return List.of();
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConditionalCommand that = (ConditionalCommand) o;
        return sameWrapper(that) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), expr, getRedirects());
    }

    @Override
    public String toString() {
        return "ConditionalCommand{expr=" + expr + "}";
    }
}
