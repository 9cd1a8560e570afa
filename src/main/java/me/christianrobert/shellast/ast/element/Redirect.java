package me.christianrobert.shellast.ast.element;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One redirection attached to a command.
 *
 * <p>{@code sourceFd} is {@code null} exactly when the operator's implicit default
 * descriptor applies. {@code hereDocDelimiter} is only set for here-documents.
 */
public class Redirect {

    @JsonProperty("direction")
    private final RedirectType direction;

    @JsonProperty("source_fd")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Integer sourceFd;

    @JsonProperty("target")
    private final RedirectTarget target;

    @JsonProperty("here_doc_eof")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String hereDocDelimiter;

    @JsonCreator
    public Redirect(@JsonProperty("direction") RedirectType direction,
                    @JsonProperty("source_fd") Integer sourceFd,
                    @JsonProperty("target") RedirectTarget target,
                    @JsonProperty("here_doc_eof") String hereDocDelimiter) {
        if (direction == null) {
            throw new IllegalArgumentException("Redirect direction cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("Redirect target cannot be null");
        }
        this.direction = direction;
        this.sourceFd = sourceFd;
        this.target = target;
        this.hereDocDelimiter = hereDocDelimiter;
    }

    public Redirect(RedirectType direction, Integer sourceFd, RedirectTarget target) {
        this(direction, sourceFd, target, null);
    }

    public static Redirect hereDoc(Integer sourceFd, String body, String delimiter) {
        return new Redirect(RedirectType.HERE_DOC, sourceFd, RedirectTarget.file(body), delimiter);
    }

    public RedirectType getDirection() {
        return direction;
    }

    public Integer getSourceFd() {
        return sourceFd;
    }

    public RedirectTarget getTarget() {
        return target;
    }

    public String getHereDocDelimiter() {
        return hereDocDelimiter;
    }

    public boolean isHereDoc() {
        return direction == RedirectType.HERE_DOC;
    }

    public int defaultFd() {
        return direction.getDefaultFd();
    }

    /**
     * The descriptor this redirect actually applies to, resolving the implicit default.
     */
    public int effectiveSourceFd() {
        return sourceFd != null ? sourceFd : direction.getDefaultFd();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Redirect redirect = (Redirect) o;
        return direction == redirect.direction
                && Objects.equals(sourceFd, redirect.sourceFd)
                && target.equals(redirect.target)
                && Objects.equals(hereDocDelimiter, redirect.hereDocDelimiter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, sourceFd, target, hereDocDelimiter);
    }

    @Override
    public String toString() {
        return "Redirect{direction=" + direction + ", sourceFd=" + sourceFd + ", target=" + target
                + (hereDocDelimiter != null ? ", hereDocDelimiter='" + hereDocDelimiter + "'" : "") + "}";
    }
}
