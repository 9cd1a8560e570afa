package me.christianrobert.shellast.foreign;

/**
 * A word as recorded by the foreign parser.
 */
public interface ForeignWord {

    /** Word text, may be null. */
    String getText();

    int getFlags();
}
