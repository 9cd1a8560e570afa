package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminator of a case clause other than the ordinary {@code ;;}.
 *
 * <p>{@code fallthrough} is {@code ;&}, {@code testNext} is {@code ;;&}.
 */
public class CaseClauseFlags {

    public static final int FALLTHROUGH_BIT = 0x01;
    public static final int TEST_NEXT_BIT = 0x02;

    @JsonProperty("fallthrough")
    private final boolean fallthrough;

    @JsonProperty("test_next")
    private final boolean testNext;

    @JsonCreator
    public CaseClauseFlags(@JsonProperty("fallthrough") boolean fallthrough,
                           @JsonProperty("test_next") boolean testNext) {
        this.fallthrough = fallthrough;
        this.testNext = testNext;
    }

    public static CaseClauseFlags fallthrough() {
        return new CaseClauseFlags(true, false);
    }

    public static CaseClauseFlags testNext() {
        return new CaseClauseFlags(false, true);
    }

    /**
     * Decodes the foreign pattern-list bitmask. Without a terminator bit the clause ends in an
     * ordinary {@code ;;} and this yields null; other bits are ignored.
     */
    public static CaseClauseFlags fromBits(int bits) {
        if ((bits & (FALLTHROUGH_BIT | TEST_NEXT_BIT)) == 0) {
            return null;
        }
        return new CaseClauseFlags((bits & FALLTHROUGH_BIT) != 0, (bits & TEST_NEXT_BIT) != 0);
    }

    public boolean isFallthrough() {
        return fallthrough;
    }

    public boolean isTestNext() {
        return testNext;
    }

    /**
     * The clause terminator as written in source. Fallthrough wins if both bits are set.
     */
    public String terminator() {
        if (fallthrough) {
            return ";&";
        }
        if (testNext) {
            return ";;&";
        }
        return ";;";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CaseClauseFlags that = (CaseClauseFlags) o;
        return fallthrough == that.fallthrough && testNext == that.testNext;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(fallthrough) * 31 + Boolean.hashCode(testNext);
    }

    @Override
    public String toString() {
        return "CaseClauseFlags{fallthrough=" + fallthrough + ", testNext=" + testNext + "}";
    }
}
