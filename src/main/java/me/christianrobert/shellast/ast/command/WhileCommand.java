package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;

/**
 * {@code while TEST; do BODY; done}
 */
public class WhileCommand extends TestLoopCommand {

    @JsonCreator
    public WhileCommand(@JsonProperty("line") Integer line,
                        @JsonProperty("test") Command test,
                        @JsonProperty("body") Command body,
                        @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, test, body, redirects);
    }

    public WhileCommand(Command test, Command body) {
        this(null, test, body, List.of());
    }

    @Override
    public String keyword() {
        return "while";
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
