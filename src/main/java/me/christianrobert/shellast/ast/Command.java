package me.christianrobert.shellast.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import me.christianrobert.shellast.ast.command.ArithmeticCommand;
import me.christianrobert.shellast.ast.command.ArithmeticForCommand;
import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.command.ConditionalCommand;
import me.christianrobert.shellast.ast.command.CoprocCommand;
import me.christianrobert.shellast.ast.command.ForCommand;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.IfCommand;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.command.SelectCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.command.SubshellCommand;
import me.christianrobert.shellast.ast.command.UntilCommand;
import me.christianrobert.shellast.ast.command.WhileCommand;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * Base class for all nodes of the canonical shell syntax tree.
 *
 * <p>One concrete subclass exists per shell construct. A tree is built once, is immutable,
 * and every child is owned by exactly one parent.
 *
 * <p>{@code line} is a best-effort source line. It is {@code null} when the parser did not
 * report a usable value, and it takes part in {@link #equals(Object)}. Use
 * {@code LineEraser} when comparing trees modulo line information.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SimpleCommand.class, name = "simple"),
        @JsonSubTypes.Type(value = PipelineCommand.class, name = "pipeline"),
        @JsonSubTypes.Type(value = ListCommand.class, name = "list"),
        @JsonSubTypes.Type(value = ForCommand.class, name = "for"),
        @JsonSubTypes.Type(value = WhileCommand.class, name = "while"),
        @JsonSubTypes.Type(value = UntilCommand.class, name = "until"),
        @JsonSubTypes.Type(value = IfCommand.class, name = "if"),
        @JsonSubTypes.Type(value = CaseCommand.class, name = "case"),
        @JsonSubTypes.Type(value = SelectCommand.class, name = "select"),
        @JsonSubTypes.Type(value = GroupCommand.class, name = "group"),
        @JsonSubTypes.Type(value = SubshellCommand.class, name = "subshell"),
        @JsonSubTypes.Type(value = FunctionDefCommand.class, name = "function_def"),
        @JsonSubTypes.Type(value = ArithmeticCommand.class, name = "arithmetic"),
        @JsonSubTypes.Type(value = ArithmeticForCommand.class, name = "arithmetic_for"),
        @JsonSubTypes.Type(value = ConditionalCommand.class, name = "conditional"),
        @JsonSubTypes.Type(value = CoprocCommand.class, name = "coproc")
})
public abstract class Command {

    @JsonProperty("line")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Integer line;

    protected Command(Integer line) {
        this.line = line;
    }

    /**
     * Source line of this node, or {@code null} if unknown.
     */
    public Integer getLine() {
        return line;
    }

    /**
     * Own line if known, otherwise the first known line among the children in source order.
     *
     * @return best available line, or {@code null} if no node in the subtree has one
     */
    public Integer bestKnownLine() {
        if (line != null) {
            return line;
        }
        for (Command child : children()) {
            Integer childLine = child.bestKnownLine();
            if (childLine != null) {
                return childLine;
            }
        }
        return null;
    }

    /**
     * Redirects attached to this node. Variants that cannot carry redirects return an empty list.
     */
    public List<Redirect> getRedirects() {
        return List.of();
    }

    /**
     * Direct child commands in source order.
     */
    public abstract List<Command> children();

    public abstract <R> R accept(CommandVisitor<R> visitor);

    protected boolean sameLine(Command other) {
        return Objects.equals(line, other.line);
    }

    protected static Command requireChild(Command child, String what) {
        if (child == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        return child;
    }

    protected static <T> List<T> copyOrEmpty(List<T> values) {
        return values != null ? List.copyOf(values) : List.of();
    }
}
