package me.christianrobert.shellast.foreign;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of handing a script to the {@link ShellParser}.
 * Contains the root of the foreign tree and any syntax diagnostics encountered.
 *
 * <p>The foreign tree may reference resources owned by the parser. They are released by
 * {@link #close()}, after which the tree must not be read again. Closing twice is harmless.
 */
public class ParseResult implements AutoCloseable {

    private final ForeignNode tree;
    private final List<String> errors;
    private final Runnable disposer;
    private boolean closed;

    public ParseResult(ForeignNode tree, List<String> errors, Runnable disposer) {
        this.tree = tree;
        this.errors = errors != null ? new ArrayList<>(errors) : new ArrayList<>();
        this.disposer = disposer;
    }

    public ParseResult(ForeignNode tree, List<String> errors) {
        this(tree, errors, null);
    }

    /**
     * Gets the foreign tree root, or null when the parser rejected the script. Diagnostics may
     * accompany an accepted script in verbose mode, so a syntax failure is a missing tree.
     */
    public ForeignNode getTree() {
        return tree;
    }

    /**
     * Checks if parsing encountered errors.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (disposer != null) {
            disposer.run();
        }
    }

    @Override
    public String toString() {
        return "ParseResult{tree=" + (tree != null) + ", errors=" + errors.size() + "}";
    }
}
