package me.christianrobert.shellast.foreign;

/**
 * Read-only view of one command node in the foreign parse tree.
 *
 * <p>A node has a wrapper part shared by all kinds (tag, line, flags, trailing redirects) and a
 * kind-specific part. Accessors for parts a kind does not have return {@code null} or 0.
 * Any accessor may return {@code null} for a malformed tree; callers must check.
 */
public interface ForeignNode {

    /**
     * Raw command-type tag, see {@link ForeignNodeKind#fromTag(int)}.
     */
    int getTag();

    /** Wrapper line, 0 if unknown. */
    int getLine();

    /** Line recorded in the kind-specific part, 0 if absent. */
    int getInnerLine();

    /** Wrapper flags, see {@link ForeignFlags}. */
    int getFlags();

    /** Connector token of a connection node. */
    int getConnector();

    ForeignNode getChild(ChildRole role);

    ForeignWordList getWordList(WordListRole role);

    String getText(TextRole role);

    /** Redirects attached to the wrapper (trailing redirects of compound commands). */
    ForeignRedirect getRedirects();

    /** Redirects recorded inside a simple command. */
    ForeignRedirect getInnerRedirects();

    /** Clause list of a case node. */
    ForeignPatternList getPatterns();

    /** Expression tree of a {@code [[ ]]} node. */
    ForeignCondNode getCondition();

    enum ChildRole {
        /** Left operand of a connection. */
        FIRST,
        /** Right operand of a connection. */
        SECOND,
        TEST,
        ACTION,
        TRUE_CASE,
        FALSE_CASE,
        BODY
    }

    enum WordListRole {
        /** Words of a simple command. */
        WORDS,
        /** Iteration list of for/select. */
        MAP_LIST,
        /** Arithmetic command expression. */
        EXPRESSION,
        INIT,
        ARITH_TEST,
        STEP
    }

    enum TextRole {
        /** Loop variable, function name or coproc name. */
        NAME,
        /** Case subject word. */
        SUBJECT,
        /** File a function was defined in. */
        SOURCE_FILE
    }
}
