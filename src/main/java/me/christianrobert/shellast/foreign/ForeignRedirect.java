package me.christianrobert.shellast.foreign;

/**
 * Linked list cell holding one redirect.
 */
public interface ForeignRedirect {

    /** Raw instruction tag, see {@link RedirectInstruction#fromTag(int)}. */
    int getInstruction();

    /** Source descriptor as written, negative when none was written. */
    int getRedirectorFd();

    /** Target descriptor for numeric duplication and move instructions. */
    int getRedirecteeFd();

    /** Target word for file-based instructions; for here-documents this is the body. */
    ForeignWord getRedirecteeWord();

    /** Here-document delimiter, null for other instructions. */
    String getHereDocDelimiter();

    ForeignRedirect getNext();
}
