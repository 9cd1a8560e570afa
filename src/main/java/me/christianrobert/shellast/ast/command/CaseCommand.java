package me.christianrobert.shellast.ast.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
import me.christianrobert.shellast.ast.element.CaseClause;
import me.christianrobert.shellast.ast.element.Redirect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code case WORD in CLAUSES esac}
 */
public class CaseCommand extends CompoundCommand {

    @JsonProperty("word")
    private final String word;

    @JsonProperty("clauses")
    private final List<CaseClause> clauses;

    @JsonCreator
    public CaseCommand(@JsonProperty("line") Integer line,
                       @JsonProperty("word") String word,
                       @JsonProperty("clauses") List<CaseClause> clauses,
                       @JsonProperty("redirects") List<Redirect> redirects) {
        super(line, redirects);
        if (word == null) {
            throw new IllegalArgumentException("Case subject cannot be null");
        }
        this.word = word;
        this.clauses = copyOrEmpty(clauses);
    }

    public CaseCommand(String word, List<CaseClause> clauses) {
        this(null, word, clauses, List.of());
    }

    public String getWord() {
        return word;
    }

    public List<CaseClause> getClauses() {
        return clauses;
    }

    @Override
    public List<Command> children() {
        List<Command> actions = new ArrayList<>();
        for (CaseClause clause : clauses) {
            if (clause.getAction() != null) {
                actions.add(clause.getAction());
            }
        }
        return actions;
    }

    @Override
    public <R> R accept(CommandVisitor<R> visitor) {
        return visitor.visitCase(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CaseCommand that = (CaseCommand) o;
        return sameWrapper(that) && word.equals(that.word) && clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), word, clauses, getRedirects());
    }

    @Override
    public String toString() {
        return "CaseCommand{word='" + word + "', clauses=" + clauses + ", redirects=" + getRedirects() + "}";
    }
}
