package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A bare word inside {@code [[ ]]}, true when non-empty.
 */
public class TermExpression extends ConditionalExpr {

    @JsonProperty("word")
    private final String word;

    @JsonCreator
    public TermExpression(@JsonProperty("word") String word) {
        this.word = requireText(word, "Term word");
    }

    public String getWord() {
        return word;
    }

    @Override
    public <R> R accept(ConditionalExprVisitor<R> visitor) {
        return visitor.visitTerm(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TermExpression && word.equals(((TermExpression) o).word);
    }

    @Override
    public int hashCode() {
        return word.hashCode();
    }

    @Override
    public String toString() {
        return "TermExpression{word='" + word + "'}";
    }
}
