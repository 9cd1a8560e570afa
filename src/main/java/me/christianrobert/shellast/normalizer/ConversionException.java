package me.christianrobert.shellast.normalizer;

/**
 * Thrown while building a command tree from a foreign parse tree that cannot be represented.
 * Captures which kind of node failed and where.
 */
public class ConversionException extends RuntimeException {

    private final String nodeKind;
    private final Integer line;

    public ConversionException(String message) {
        super(message);
        this.nodeKind = null;
        this.line = null;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.nodeKind = null;
        this.line = null;
    }

    public ConversionException(String message, String nodeKind, Integer line) {
        super(message);
        this.nodeKind = nodeKind;
        this.line = line;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public Integer getLine() {
        return line;
    }

    /**
     * Gets a detailed error message including node kind and line.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (nodeKind != null) {
            sb.append("\nNode: ").append(nodeKind);
        }
        if (line != null) {
            sb.append("\nLine: ").append(line);
        }
        return sb.toString();
    }
}
