package me.christianrobert.shellast.foreign;

/**
 * Foreign redirect instructions, in the order of the shell's own enumeration.
 */
public enum RedirectInstruction {
    OUTPUT_DIRECTION,
    INPUT_DIRECTION,
    INPUTA_DIRECTION,
    APPENDING_TO,
    READING_UNTIL,
    READING_STRING,
    DUPLICATING_INPUT,
    DUPLICATING_OUTPUT,
    DEBLANK_READING_UNTIL,
    CLOSE_THIS,
    ERR_AND_OUT,
    INPUT_OUTPUT,
    OUTPUT_FORCE,
    DUPLICATING_INPUT_WORD,
    DUPLICATING_OUTPUT_WORD,
    MOVE_INPUT,
    MOVE_OUTPUT,
    MOVE_INPUT_WORD,
    MOVE_OUTPUT_WORD,
    APPEND_ERR_AND_OUT;

    private static final RedirectInstruction[] BY_TAG = values();

    /**
     * @return the instruction for a raw tag, or null if the tag is not recognized
     */
    public static RedirectInstruction fromTag(int tag) {
        if (tag < 0 || tag >= BY_TAG.length) {
            return null;
        }
        return BY_TAG[tag];
    }

    public int getTag() {
        return ordinal();
    }
}
