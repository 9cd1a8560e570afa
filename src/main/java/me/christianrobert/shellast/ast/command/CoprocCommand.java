package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code coproc [NAME] BODY}
 */
public class CoprocCommand extends Command {

    public static final String DEFAULT_NAME = "COPROC";

    @JsonProperty("name")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String name;

    @JsonProperty("body")
    private final Command body;

    @JsonCreator
    public CoprocCommand(@JsonProperty("line") Integer line,
                         @JsonProperty("name") String name,
                         @JsonProperty("body") Command body) {
        super(line);
        this.name = name;
        this.body = requireChild(body, "Coproc body");
    }

    public CoprocCommand(String name, Command body) {
        this(null, name, body);
    }

    /** Null when no name was recorded. */
    public String getName() {
        return name;
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
        return visitor.visitCoproc(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CoprocCommand that = (CoprocCommand) o;
        return sameLine(that) && Objects.equals(name, that.name) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), name, body);
    }

    @Override
    public String toString() {
        return "CoprocCommand{name=" + name + ", body=" + body + "}";
    }
}
