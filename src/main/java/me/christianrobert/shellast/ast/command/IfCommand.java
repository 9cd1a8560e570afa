package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code if COND; then A; [else B;] fi}
 *
 * <p>An {@code elif} chain is represented as a nested {@code IfCommand} in the else-branch.
 */
public class IfCommand extends CompoundCommand {

    @JsonProperty("condition")
    private final Command condition;

    @JsonProperty("then_branch")
    private final Command thenBranch;

    @JsonProperty("else_branch")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Command elseBranch;

    @JsonCreator
    public IfCommand(@JsonProperty("line") Integer line,
                     @JsonProperty("condition") Command condition,
                     @JsonProperty("then_branch") Command thenBranch,
                     @JsonProperty("else_branch") Command elseBranch,
                     @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        this.condition = requireChild(condition, "If condition");
        this.thenBranch = requireChild(thenBranch, "Then branch");
        this.elseBranch = elseBranch;
    }

    public IfCommand(Command condition, Command thenBranch, Command elseBranch) {
        this(null, condition, thenBranch, elseBranch, List.of());
    }

    public Command getCondition() {
        return condition;
    }

    public Command getThenBranch() {
        return thenBranch;
    }

    /** Null when there is no else-branch. */
    public Command getElseBranch() {
        return elseBranch;
    }

    /**
     * True when the else-branch can be written as {@code elif}: it is itself an if-statement
     * without redirects of its own.
     */
    public boolean hasElifBranch() {
        return elseBranch instanceof IfCommand && elseBranch.getRedirects().isEmpty();
    }

    @Override
    public List<Command> children() {
        List<Command> children = new ArrayList<>(3);
        children.add(condition);
        children.add(thenBranch);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IfCommand that = (IfCommand) o;
        return sameWrapper(that)
                && condition.equals(that.condition)
                && thenBranch.equals(that.thenBranch)
                && Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), condition, thenBranch, elseBranch, getRedirects());
    }

    @Override
    public String toString() {
        return "IfCommand{condition=" + condition + ", thenBranch=" + thenBranch
                + ", elseBranch=" + elseBranch + ", redirects=" + getRedirects() + "}";
    }
}
