package me.christianrobert.shellast.ast.conditional;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base class for the expression tree inside {@code [[ ... ]]}.
 *
 * <p>Concrete node kinds are discriminated by {@code cond_type} in the interchange format.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "cond_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UnaryTest.class, name = "unary"),
        @JsonSubTypes.Type(value = BinaryTest.class, name = "binary"),
        @JsonSubTypes.Type(value = AndExpression.class, name = "and"),
        @JsonSubTypes.Type(value = OrExpression.class, name = "or"),
        @JsonSubTypes.Type(value = NotExpression.class, name = "not"),
        @JsonSubTypes.Type(value = TermExpression.class, name = "term"),
        @JsonSubTypes.Type(value = GroupedExpression.class, name = "expr")
})
public abstract class ConditionalExpr {

    /**
     * Dispatches to the visitor method for this node kind.
     */
    public abstract <R> R accept(ConditionalExprVisitor<R> visitor);

    static ConditionalExpr requireOperand(ConditionalExpr expr, String what) {
        if (expr == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        return expr;
    }

    static String requireText(String text, String what) {
        if (text == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        return text;
    }
}
