package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code name() BODY}
 *
 * <p>{@code sourceFile} is the file the parser reported the function as defined in. It is
 * diagnostic metadata only and never written back out as shell text.
 */
public class FunctionDefCommand extends Command {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("body")
    private final Command body;

    @JsonProperty("source_file")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String sourceFile;

    @JsonCreator
    public FunctionDefCommand(@JsonProperty("line") Integer line,
                              @JsonProperty("name") String name,
                              @JsonProperty("body") Command body,
                              @JsonProperty("source_file") String sourceFile) {
        super(line);
        if (name == null) {
            throw new IllegalArgumentException("Function name cannot be null");
        }
        this.name = name;
        this.body = requireChild(body, "Function body");
        this.sourceFile = sourceFile;
    }

    public FunctionDefCommand(String name, Command body) {
        this(null, name, body, null);
    }

    public String getName() {
        return name;
    }

    public Command getBody() {
        return body;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    @Override
    public List<Command> children() {
        return List.of(body);
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionDefCommand that = (FunctionDefCommand) o;
        return sameLine(that)
                && name.equals(that.name)
                && body.equals(that.body)
                && Objects.equals(sourceFile, that.sourceFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), name, body, sourceFile);
    }

    @Override
    public String toString() {
        return "FunctionDefCommand{name='" + name + "', body=" + body + ", sourceFile=" + sourceFile + "}";
    }
}
