package me.christianrobert.shellast.json;

/**
 * Thrown when a command tree cannot be encoded to, or decoded from, the JSON interchange format.
 */
public class InterchangeException extends RuntimeException {

    private final String json;

    public InterchangeException(String message, Throwable cause) {
        super(message, cause);
        this.json = null;
    }

    public InterchangeException(String message, String json, Throwable cause) {
        super(message, cause);
        this.json = json;
    }

    public String getJson() {
        return json;
    }

    /**
     * Gets a detailed error message including the underlying cause and a snippet of the input.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append("\nCause: ").append(getCause().getMessage());
        }
        if (json != null) {
            String snippet = json.length() > 200 ? json.substring(0, 200) + "..." : json;
            sb.append("\nJSON: ").append(snippet);
        }
        return sb.toString();
    }
}
