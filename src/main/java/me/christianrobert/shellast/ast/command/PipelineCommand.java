package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Commands joined by {@code |}, optionally negated with a leading {@code !}.
 *
 * <p>The stage list is flat: it never holds another pipeline. A single negated command
 * ({@code ! cmd}) is a one-stage pipeline.
 */
public class PipelineCommand extends Command {

    @JsonProperty("commands")
    private final List<Command> commands;

    @JsonProperty("negated")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private final boolean negated;

    @JsonCreator
    public PipelineCommand(@JsonProperty("line") Integer line,
                           @JsonProperty("commands") List<Command> commands,
                           @JsonProperty("negated") boolean negated) {
        super(line);
        if (commands == null || commands.isEmpty()) {
            throw new IllegalArgumentException("Pipeline must have at least one command");
        }
        for (Command stage : commands) {
            if (stage == null) {
                throw new IllegalArgumentException("Pipeline stage cannot be null");
            }
            if (stage instanceof PipelineCommand) {
                throw new IllegalArgumentException("Pipeline stage cannot itself be a pipeline");
            }
        }
        this.commands = List.copyOf(commands);
        this.negated = negated;
    }

    public PipelineCommand(List<Command> commands, boolean negated) {
        this(null, commands, negated);
    }

    public List<Command> getCommands() {
        return commands;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public List<Command> children() {
        return commands;
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitPipeline(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PipelineCommand that = (PipelineCommand) o;
        return sameLine(that) && negated == that.negated && commands.equals(that.commands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), commands, negated);
    }

    @Override
    public String toString() {
        return "PipelineCommand{commands=" + commands + ", negated=" + negated + "}";
    }
}
