package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;

/**
 * {@code until TEST; do BODY; done}
 */
public class UntilCommand extends TestLoopCommand {

    @JsonCreator
    public UntilCommand(@JsonProperty("line") Integer line,
                        @JsonProperty("test") Command test,
                        @JsonProperty("body") Command body,
                        @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, test, body, redirects);
    }

    public UntilCommand(Command test, Command body) {
        this(null, test, body, List.of());
    }

    @Override
    public String keyword() {
        return "until";
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitUntil(this);
    }
}
