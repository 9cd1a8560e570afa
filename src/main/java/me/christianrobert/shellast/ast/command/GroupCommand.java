package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * {@code { BODY; }}, run in the current shell.
 */
public class GroupCommand extends CompoundCommand {

    @JsonProperty("body")
    private final Command body;

    @JsonCreator
    public GroupCommand(@JsonProperty("line") Integer line,
                        @JsonProperty("body") Command body,
                        @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        this.body = requireChild(body, "Group body");
    }

    public GroupCommand(Command body) {
        this(null, body, List.of());
    }

    public Command getBody() {
        return body;
    }

    @Override
    public List<Command> children() {
        return List.of(body);
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupCommand that = (GroupCommand) o;
        return sameWrapper(that) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), body, getRedirects());
    }

    @Override
    public String toString() {
        return "GroupCommand{body=" + body + ", redirects=" + getRedirects() + "}";
    }
}
