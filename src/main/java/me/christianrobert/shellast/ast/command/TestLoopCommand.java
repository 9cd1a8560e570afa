package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * Shared shape of {@code while} and {@code until}. The two differ only in keyword.
 */
public abstract class TestLoopCommand extends CompoundCommand {

    @JsonProperty("test")
    private final Command test;

    @JsonProperty("body")
    private final Command body;

    protected TestLoopCommand(Integer line, Command test, Command body, List<Redirect> redirects) {
        super(line, redirects);
        this.test = requireChild(test, "Loop test");
        this.body = requireChild(body, "Loop body");
    }

    public Command getTest() {
        return test;
    }

    public Command getBody() {
        return body;
    }

    /**
     * The keyword that opens this loop.
     */
    public abstract String keyword();

    @Override
    public List<Command> children() {
        return List.of(test, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TestLoopCommand that = (TestLoopCommand) o;
        return sameWrapper(that) && test.equals(that.test) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), getLine(), test, body, getRedirects());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{test=" + test + ", body=" + body
                + ", redirects=" + getRedirects() + "}";
    }
}
