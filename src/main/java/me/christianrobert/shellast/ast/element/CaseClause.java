package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;

import java.util.List;
import java.util.Objects;

/**
 * One arm of a case statement: {@code p1|p2) action ;;}.
 */
public class CaseClause {

    @JsonProperty("patterns")
    private final List<String> patterns;

    @JsonProperty("action")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Command action;

    @JsonProperty("flags")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final CaseClauseFlags flags;

    @JsonCreator
    public CaseClause(@JsonProperty("patterns") List<String> patterns,
                      @JsonProperty("action") Command action,
                      @JsonProperty("flags") CaseClauseFlags flags) {
        this.patterns = patterns != null ? List.copyOf(patterns) : List.of();
        this.action = action;
        this.flags = flags;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /** Null for an empty clause body ({@code p) ;;}). */
    public Command getAction() {
        return action;
    }

    /** Null for the ordinary {@code ;;} terminator. */
    public CaseClauseFlags getFlags() {
        return flags;
    }

    public String terminator() {
        return flags != null ? flags.terminator() : ";;";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CaseClause that = (CaseClause) o;
        return patterns.equals(that.patterns)
                && Objects.equals(action, that.action)
                && Objects.equals(flags, that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patterns, action, flags);
    }

    @Override
    public String toString() {
        return "CaseClause{patterns=" + patterns + ", action=" + action + ", flags=" + flags + "}";
    }
}
