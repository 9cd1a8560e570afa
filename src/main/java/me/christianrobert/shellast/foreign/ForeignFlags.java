package me.christianrobert.shellast.foreign;

/**
 * Bit values and tokens used by the foreign tree.
 */
public final class ForeignFlags {

    /** Command flag: {@code !} in front of a pipeline or {@code [[ ]]} term. */
    public static final int CMD_INVERT_RETURN = 0x04;

    /** Word flag: the word is an assignment. */
    public static final int W_ASSIGNMENT = 1 << 2;

    /** Case clause flag: {@code ;&}. */
    public static final int CASEPAT_FALLTHROUGH = 0x01;

    /** Case clause flag: {@code ;;&}. */
    public static final int CASEPAT_TESTNEXT = 0x02;

    // Connector tokens
    public static final int CONNECTOR_PIPE = '|';
    public static final int CONNECTOR_BACKGROUND = '&';
    public static final int CONNECTOR_SEMICOLON = ';';
    public static final int CONNECTOR_NEWLINE = '\n';
    public static final int AND_AND = 288;
    public static final int OR_OR = 289;
    public static final int AND_AND_PACKED = ('&' << 8) | '&';
    public static final int OR_OR_PACKED = ('|' << 8) | '|';

    // Conditional node types
    public static final int COND_AND = 1;
    public static final int COND_OR = 2;
    public static final int COND_UNARY = 3;
    public static final int COND_BINARY = 4;
    public static final int COND_TERM = 5;
    public static final int COND_EXPR = 6;

    private ForeignFlags() {
    }

    public static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }
}
