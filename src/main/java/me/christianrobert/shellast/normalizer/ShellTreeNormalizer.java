package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.foreign.ForeignNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Entry point for turning a foreign parse tree into a canonical command tree.
 *
 * <p>Never owns, mutates or retains the foreign tree. Any conversion failure anywhere in the
 * tree yields an empty result, including nesting deeper than {@code maxDepth}. Linked lists are
 * read up to {@code maxListLength} entries.
 */
public class ShellTreeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ShellTreeNormalizer.class);

    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int DEFAULT_MAX_LIST_LENGTH = 100_000;

    private final int maxDepth;
    private final int maxListLength;

    public ShellTreeNormalizer() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_LIST_LENGTH);
    }

    public ShellTreeNormalizer(int maxDepth, int maxListLength) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive");
        }
        if (maxListLength < 1) {
            throw new IllegalArgumentException("Maximum list length must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxListLength = maxListLength;
    }

    /**
     * Converts a foreign tree.
     *
     * @param root Foreign root node, may be null
     * @return The canonical tree, or empty if the root is absent or any part fails to convert
     */
    public Optional<Command> normalize(ForeignNode root) {
        if (root == null) {
            log.debug("No foreign tree to normalize");
            return Optional.empty();
        }
        try {
            Command command = new CommandTreeBuilder(maxDepth, maxListLength).visit(root);
            log.debug("Normalized foreign tree into {}", command.getClass().getSimpleName());
            return Optional.of(command);
        } catch (ConversionException e) {
            log.debug("Conversion failed: {}", e.getDetailedMessage());
            return Optional.empty();
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxListLength() {
        return maxListLength;
    }
}
