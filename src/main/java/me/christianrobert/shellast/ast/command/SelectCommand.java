package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;

/**
 * {@code select NAME [in WORDS]; do BODY; done}
 */
public class SelectCommand extends WordIterationCommand {

    @JsonCreator
    public SelectCommand(@JsonProperty("line") Integer line,
                         @JsonProperty("variable") String variable,
                         @JsonProperty("words") List<String> words,
                         @JsonProperty("body") Command body,
                         @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, variable, words, body, redirects);
    }

    public SelectCommand(String variable, List<String> words, Command body) {
        this(null, variable, words, body, List.of());
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }
}
