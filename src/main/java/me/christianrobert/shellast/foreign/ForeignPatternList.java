package me.christianrobert.shellast.foreign;

/**
 * Linked list cell holding one case clause.
 */
public interface ForeignPatternList {

    ForeignWordList getPatterns();

    /** Clause body, null for an empty clause. */
    ForeignNode getAction();

    /** Terminator bits, see {@link ForeignFlags#CASEPAT_FALLTHROUGH}. */
    int getFlags();

    ForeignPatternList getNext();
}
