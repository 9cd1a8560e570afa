package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator joining the two operands of a list node.
 */
public enum ListOp {

    @JsonProperty("and")
    AND("&&"),

    @JsonProperty("or")
    OR("||"),

    @JsonProperty("semi")
    SEMICOLON(";"),

    @JsonProperty("amp")
    BACKGROUND("&"),

    @JsonProperty("newline")
    NEWLINE("\n");

    private final String symbol;

    ListOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * {@code &&} and {@code ||} keep both operands on one logical line.
     */
    public boolean isConditional() {
        return this == AND || this == OR;
    }
}
