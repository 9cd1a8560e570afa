package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Redirection operators.
 *
 * <p>Each operator knows the file descriptor it applies to when none is written
 * explicitly: 0 for input-like operators, 1 for output-like ones.
 */
public enum RedirectType {

    /** {@code <} */
    @JsonProperty("input")
    INPUT("<", 0),

    /** {@code >} */
    @JsonProperty("output")
    OUTPUT(">", 1),

    /** {@code >>} */
    @JsonProperty("append")
    APPEND(">>", 1),

    /** {@code <<} (and {@code <<-}) */
    @JsonProperty("here_doc")
    HERE_DOC("<<", 0),

    /** {@code <<<} */
    @JsonProperty("here_string")
    HERE_STRING("<<<", 0),

    /** {@code <>} */
    @JsonProperty("input_output")
    INPUT_OUTPUT("<>", 0),

    /** {@code >|} */
    @JsonProperty("clobber")
    CLOBBER(">|", 1),

    /** {@code <&n} */
    @JsonProperty("dup_input")
    DUP_INPUT("<&", 0),

    /** {@code >&n} */
    @JsonProperty("dup_output")
    DUP_OUTPUT(">&", 1),

    /** {@code n>&-} */
    @JsonProperty("close")
    CLOSE(">&-", 1),

    /** {@code &>} */
    @JsonProperty("err_and_out")
    ERR_AND_OUT("&>", 1),

    /** {@code &>>} */
    @JsonProperty("append_err_and_out")
    APPEND_ERR_AND_OUT("&>>", 1),

    /** {@code <&n-} */
    @JsonProperty("move_input")
    MOVE_INPUT("<&", 0),

    /** {@code >&n-} */
    @JsonProperty("move_output")
    MOVE_OUTPUT(">&", 1);

    private final String operator;
    private final int defaultFd;

    RedirectType(String operator, int defaultFd) {
        this.operator = operator;
        this.defaultFd = defaultFd;
    }

    public String getOperator() {
        return operator;
    }

    public int getDefaultFd() {
        return defaultFd;
    }

    public boolean isInputLike() {
        return defaultFd == 0;
    }

    public boolean isMove() {
        return this == MOVE_INPUT || this == MOVE_OUTPUT;
    }

    public boolean isDuplication() {
        return this == DUP_INPUT || this == DUP_OUTPUT;
    }

    /**
     * {@code &>} and {@code &>>} redirect both streams and never take a source fd prefix.
     */
    public boolean isBothStreams() {
        return this == ERR_AND_OUT || this == APPEND_ERR_AND_OUT;
    }
}
