package me.christianrobert.shellast.foreign;

/**
 * Foreign command-type tags, in the order of the shell's own enumeration.
 */
public enum ForeignNodeKind {
    FOR,
    CASE,
    WHILE,
    IF,
    SIMPLE,
    SELECT,
    CONNECTION,
    FUNCTION_DEF,
    UNTIL,
    GROUP,
    ARITH,
    COND,
    ARITH_FOR,
    SUBSHELL,
    COPROC;

    private static final ForeignNodeKind[] BY_TAG = values();

    /**
     * @return the kind for a raw tag, or null if the tag is not recognized
     */
    public static ForeignNodeKind fromTag(int tag) {
        if (tag < 0 || tag >= BY_TAG.length) {
            return null;
        }
        return BY_TAG[tag];
    }

    public int getTag() {
        return ordinal();
    }
}
