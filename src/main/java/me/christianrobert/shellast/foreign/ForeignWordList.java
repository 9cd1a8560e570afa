package me.christianrobert.shellast.foreign;

/**
 * Linked list cell holding one word.
 */
public interface ForeignWordList {

    /** May be null; such cells are skipped. */
    ForeignWord getWord();

    ForeignWordList getNext();
}
