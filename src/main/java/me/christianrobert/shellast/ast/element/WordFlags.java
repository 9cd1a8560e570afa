package me.christianrobert.shellast.ast.element;

/**
 * Lexical marker bits carried by a {@link Word}.
 *
 * <p>Bit positions follow the shell's own word descriptor flags, so the foreign
 * parser's bitmask can be stored without translation.
 */
public final class WordFlags {

    public static final int HAS_DOLLAR = 1;
    public static final int QUOTED = 1 << 1;
    public static final int ASSIGNMENT = 1 << 2;
    public static final int SPLIT_SPACE = 1 << 3;
    public static final int NO_SPLIT = 1 << 4;
    public static final int NO_GLOB = 1 << 5;
    public static final int COMPOUND_ASSIGNMENT = 1 << 15;
    public static final int ASSIGNMENT_BUILTIN = 1 << 16;
    public static final int ASSIGNMENT_ARGUMENT = 1 << 17;

    private WordFlags() {
    }

    public static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }
}
