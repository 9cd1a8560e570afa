package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single shell word: its text as written plus the lexical flags the parser recorded.
 */
public class Word {

    @JsonProperty("word")
    private final String text;

    @JsonProperty("flags")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private final int flags;

    @JsonCreator
    public Word(@JsonProperty("word") String text, @JsonProperty("flags") int flags) {
        if (text == null) {
            throw new IllegalArgumentException("Word text cannot be null");
        }
        this.text = text;
        this.flags = flags;
    }

    public Word(String text) {
        this(text, 0);
    }

    public String getText() {
        return text;
    }

    public int getFlags() {
        return flags;
    }

    public boolean isAssignment() {
        return WordFlags.isSet(flags, WordFlags.ASSIGNMENT);
    }

    public boolean isQuoted() {
        return WordFlags.isSet(flags, WordFlags.QUOTED);
    }

    public boolean hasDollar() {
        return WordFlags.isSet(flags, WordFlags.HAS_DOLLAR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Word word = (Word) o;
        return flags == word.flags && text.equals(word.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, flags);
    }

    @Override
    public String toString() {
        return "Word{text='" + text + "', flags=" + flags + "}";
    }
}
