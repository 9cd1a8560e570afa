package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.List;

/**
 * A compound construct that may carry trailing wrapper redirects,
 * as in {@code while read l; do ...; done < file}.
 */
public abstract class CompoundCommand extends Command {

    @JsonProperty("redirects")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<Redirect> redirects;

    protected CompoundCommand(Integer line, List<Redirect> redirects) {
        super(line);
        this.redirects = copyOrEmpty(redirects);
    }

    @Override
    public List<Redirect> getRedirects() {
        return redirects;
    }

    protected boolean sameWrapper(CompoundCommand other) {
        return sameLine(other) && redirects.equals(other.redirects);
    }
}
