package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.Word;

import java.util.List;
import java.util.Objects;

/**
 * A simple command: assignments, then the command name and its arguments, plus redirects.
 *
 * <p>{@code words} holds only the positional words. Assignment words such as {@code FOO=bar}
 * are kept in {@code assignments} in their original relative order.
 *
 * <p>A simple command with no words, no assignments and no redirects is the placeholder used
 * for the missing right operand of a trailing {@code &}.
 */
public class SimpleCommand extends Command {

    @JsonProperty("words")
    private final List<Word> words;

    @JsonProperty("redirects")
    private final List<Redirect> redirects;

    @JsonProperty("assignments")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<String> assignments;

    @JsonCreator
    public SimpleCommand(@JsonProperty("line") Integer line,
                         @JsonProperty("words") List<Word> words,
                         @JsonProperty("redirects") List<Redirect> redirects,
                         @JsonProperty("assignments") List<String> assignments) {
        super(line);
        this.words = copyOrEmpty(words);
        this.redirects = copyOrEmpty(redirects);
        this.assignments = copyOrEmpty(assignments);
    }

    public SimpleCommand(List<Word> words) {
        this(null, words, List.of(), List.of());
    }

    /**
     * The placeholder standing in for an absent command.
     */
    public static SimpleCommand emptyPlaceholder() {
        return new SimpleCommand(null, List.of(), List.of(), List.of());
    }

    public List<Word> getWords() {
        return words;
    }

    @Override
    public List<Redirect> getRedirects() {
        return redirects;
    }

    public List<String> getAssignments() {
        return assignments;
    }

    /**
     * Name of the command being run, or {@code null} for a pure assignment or redirect-only command.
     */
    public String commandName() {
        return words.isEmpty() ? null : words.get(0).getText();
    }

    public boolean isEmptyPlaceholder() {
        return words.isEmpty() && assignments.isEmpty() && redirects.isEmpty();
    }

    @Override
    public List<Command> children() {
        return List.of();
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SimpleCommand that = (SimpleCommand) o;
        return sameLine(that)
                && words.equals(that.words)
                && redirects.equals(that.redirects)
                && assignments.equals(that.assignments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), words, redirects, assignments);
    }

    @Override
    public String toString() {
        return "SimpleCommand{line=" + getLine() + ", words=" + words + ", redirects=" + redirects
                + ", assignments=" + assignments + "}";
    }
}
