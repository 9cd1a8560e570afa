package me.christianrobert.shellast.foreign;

/**
 * The external shell grammar engine.
 *
 * <p>Implementations wrap a fully compliant shell parser and expose its output through the
 * read-only {@link ForeignNode} view. They are generally not reentrant: callers must run
 * {@link #initialize()} once before the first parse and must not parse from two threads at once.
 * {@code ShellAstService} takes care of both.
 */
public interface ShellParser {

    /**
     * One-time global setup of the parser. Called once before the first {@link #parse}.
     */
    void initialize();

    /**
     * Parses a script.
     *
     * @param script Script text, validated by the caller (non-blank, no NUL characters)
     * @param verbose Whether the parser should collect human-readable diagnostics
     * @return Result holding the tree, or no tree and diagnostics on a syntax error.
     *         Must be closed by the caller.
     */
    ParseResult parse(String script, boolean verbose);
}
