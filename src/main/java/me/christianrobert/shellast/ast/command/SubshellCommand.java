package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * {@code ( BODY )}, run in a child shell.
 */
public class SubshellCommand extends CompoundCommand {

    @JsonProperty("body")
    private final Command body;

    @JsonCreator
    public SubshellCommand(@JsonProperty("line") Integer line,
                           @JsonProperty("body") Command body,
                           @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        this.body = requireChild(body, "Subshell body");
    }

    public SubshellCommand(Command body) {
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
        return visitor.visitSubshell(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SubshellCommand that = (SubshellCommand) o;
        return sameWrapper(that) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), body, getRedirects());
    }

    @Override
    public String toString() {
        return "SubshellCommand{body=" + body + ", redirects=" + getRedirects() + "}";
    }
}
