package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.ListOp;

import java.util.List;
import java.util.Objects;

/**
 * Two commands joined by a list operator. Longer chains are nested binary nodes.
 */
public class ListCommand extends Command {

    @JsonProperty("op")
    private final ListOp op;

    @JsonProperty("left")
    private final Command left;

    @JsonProperty("right")
    private final Command right;

    @JsonCreator
    public ListCommand(@JsonProperty("line") Integer line,
                       @JsonProperty("op") ListOp op,
                       @JsonProperty("left") Command left,
                       @JsonProperty("right") Command right) {
        super(line);
        if (op == null) {
            throw new IllegalArgumentException("List operator cannot be null");
        }
        this.op = op;
        this.left = requireChild(left, "Left operand");
        this.right = requireChild(right, "Right operand");
    }

    public ListCommand(ListOp op, Command left, Command right) {
        this(null, op, left, right);
    }

    public ListOp getOp() {
        return op;
    }

    public Command getLeft() {
        return left;
    }

    public Command getRight() {
        return right;
    }

    /**
     * True for {@code cmd &} with nothing following it on the same logical line.
     */
    public boolean isTrailingBackground() {
        return op == ListOp.BACKGROUND
                && right instanceof SimpleCommand
                && ((SimpleCommand) right).isEmptyPlaceholder();
    }

    @Override
    public List<Command> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ListCommand that = (ListCommand) o;
        return sameLine(that) && op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), op, left, right);
    }

    @Override
    public String toString() {
        return "ListCommand{op=" + op + ", left=" + left + ", right=" + right + "}";
    }
}
