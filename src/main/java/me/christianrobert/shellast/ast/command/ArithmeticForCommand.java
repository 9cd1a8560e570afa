package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;
import java.util.Objects;

/**
 * {@code for (( INIT; TEST; STEP )); do BODY; done}
 *
 * <p>The three clauses are raw arithmetic text and may be empty.
 */
public class ArithmeticForCommand extends CompoundCommand {

    @JsonProperty("init")
    private final String init;

    @JsonProperty("test")
    private final String test;

    @JsonProperty("step")
    private final String step;

    @JsonProperty("body")
    private final Command body;

    @JsonCreator
    public ArithmeticForCommand(@JsonProperty("line") Integer line,
                                @JsonProperty("init") String init,
                                @JsonProperty("test") String test,
                                @JsonProperty("step") String step,
                                @JsonProperty("body") Command body,
                                @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        this.init = init != null ? init : "";
        this.test = test != null ? test : "";
        this.step = step != null ? step : "";
        this.body = requireChild(body, "Loop body");
    }

    public ArithmeticForCommand(String init, String test, String step, Command body) {
        this(null, init, test, step, body, List.of());
    }

    public String getInit() {
        return init;
    }

    public String getTest() {
        return test;
    }

    public String getStep() {
        return step;
    }

    public Command getBody() {
        return body;
    }

    @Override
    public List<Command> children() {
        return List.of(body);
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitArithmeticFor(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArithmeticForCommand that = (ArithmeticForCommand) o;
        return sameWrapper(that)
                && init.equals(that.init)
                && test.equals(that.test)
                && step.equals(that.step)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), init, test, step, body, getRedirects());
    }

    @Override
    public String toString() {
        return "ArithmeticForCommand{init='" + init + "', test='" + test + "', step='" + step
                + "', body=" + body + "}";
    }
}
