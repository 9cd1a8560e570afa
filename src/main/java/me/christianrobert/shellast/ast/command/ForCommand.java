package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;

/**
 * {@code for NAME [in WORDS]; do BODY; done}
 */
public class ForCommand extends WordIterationCommand {

    @JsonCreator
    public ForCommand(@JsonProperty("line") Integer line,
                      @JsonProperty("variable") String variable,
                      @JsonProperty("words") List<String> words,
                      @JsonProperty("body") Command body,
                      @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, variable, words, body, redirects);
    }

    public ForCommand(String variable, List<String> words, Command body) {
        this(null, variable, words, body, List.of());
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
