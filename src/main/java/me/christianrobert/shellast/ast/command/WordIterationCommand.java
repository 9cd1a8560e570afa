package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * Shared shape of {@code for} and {@code select}: a variable bound to each word of a list.
 *
 * <p>{@code words == null} means no {@code in} clause was written and the positional
 * parameters are iterated. An empty list means {@code in} was written with no words.
 */
public abstract class WordIterationCommand extends CompoundCommand {

    @JsonProperty("variable")
    private final String variable;

    @JsonProperty("words")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final List<String> words;

    @JsonProperty("body")
    private final Command body;

    protected WordIterationCommand(Integer line, String variable, List<String> words, Command body,
                                   List<Redirect> redirects) {
        super(line, redirects);
        if (variable == null) {
            throw new IllegalArgumentException("Loop variable cannot be null");
        }
        this.variable = variable;
        this.words = words != null ? List.copyOf(words) : null;
        this.body = requireChild(body, "Loop body");
    }

    public String getVariable() {
        return variable;
    }

    /** Null when the positional parameters are iterated. */
    public List<String> getWords() {
        return words;
    }

    public Command getBody() {
        return body;
    }

    public boolean iteratesPositionalParameters() {
        return words == null;
    }

    @Override
    public List<Command> children() {
        return List.of(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WordIterationCommand that = (WordIterationCommand) o;
        return sameWrapper(that)
                && variable.equals(that.variable)
                && Objects.equals(words, that.words)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), getLine(), variable, words, body, getRedirects());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{variable='" + variable + "', words=" + words
                + ", body=" + body + ", redirects=" + getRedirects() + "}";
    }
}
