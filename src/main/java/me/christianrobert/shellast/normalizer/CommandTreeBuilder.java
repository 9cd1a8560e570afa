package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.foreign.ForeignFlags;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ForeignNodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Walks a foreign parse tree and builds the canonical command tree.
 * This is the only class family that reads foreign nodes.
 *
 * <p>Architecture: {@link #visit(ForeignNode)} dispatches on the node tag to a static
 * {@code VisitXxx.v(node, builder)} helper, which calls back into {@code visit} for children.
 * Every failure is raised as {@link ConversionException} and aborts the whole tree.
 *
 * <p>One builder per conversion: it tracks the current nesting depth and is not thread-safe.
 */
public class CommandTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(CommandTreeBuilder.class);

    /** Foreign lines above this are uninitialized garbage. */
    static final int MAX_PLAUSIBLE_LINE = 1_000_000;

    private final int maxDepth;
    private final int maxListLength;
    private int depth;

    public CommandTreeBuilder(int maxDepth, int maxListLength) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive");
        }
        if (maxListLength < 1) {
            throw new IllegalArgumentException("Maximum list length must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxListLength = maxListLength;
    }

    // ========== DISPATCH ==========

    /**
     * Converts one foreign node (and its subtree).
     *
     * @param node Foreign node, must not be null
     * @return Canonical command
     * @throws ConversionException if the node or any descendant cannot be converted
     */
    public Command visit(ForeignNode node) {
        if (node == null) {
            throw new ConversionException("Missing required command node");
        }
        try {
            enter();
            ForeignNodeKind kind = ForeignNodeKind.fromTag(node.getTag());
            if (kind == null) {
                throw new ConversionException("Unrecognized command tag " + node.getTag(),
                        "tag " + node.getTag(), lineOf(node));
            }
            log.trace("Visiting {} node at depth {}", kind, depth);

            Command command;
            try {
                command = dispatch(kind, node);
            } catch (IllegalArgumentException e) {
                throw new ConversionException("Invalid " + kind + " node: " + e.getMessage(), e);
            }
            return applyInversion(node, command);
        } finally {
            leave();
        }
    }

    /**
     * Like {@link #visit(ForeignNode)} but maps an absent node to {@code null}.
     * A present node that fails to convert still fails.
     */
    public Command visitOptional(ForeignNode node) {
        return node == null ? null : visit(node);
    }

    private Command dispatch(ForeignNodeKind kind, ForeignNode node) {
        return switch (kind) {
            case SIMPLE -> VisitSimpleCommand.v(node, this);
            case CONNECTION -> VisitConnection.v(node, this);
            case FOR, SELECT -> VisitIterationCommand.v(kind, node, this);
            case WHILE, UNTIL -> VisitTestLoop.v(kind, node, this);
            case IF -> VisitIfCommand.v(node, this);
            case CASE -> VisitCaseCommand.v(node, this);
            case GROUP, SUBSHELL -> VisitGroupingCommand.v(kind, node, this);
            case FUNCTION_DEF -> VisitFunctionDef.v(node, this);
            case ARITH -> VisitArithmetic.v(node, this);
            case ARITH_FOR -> VisitArithmetic.forLoop(node, this);
            case COND -> VisitConditional.v(node, this);
            case COPROC -> VisitCoproc.v(node, this);
        };
    }

    /**
     * A {@code !} on anything other than a pipe connection becomes a one-stage negated pipeline.
     * Pipe connections read the flag themselves.
     */
    private Command applyInversion(ForeignNode node, Command command) {
        if (!ForeignFlags.isSet(node.getFlags(), ForeignFlags.CMD_INVERT_RETURN)
                || command instanceof PipelineCommand) {
            return command;
        }
        return new PipelineCommand(null, List.of(command), true);
    }

    // ========== DEPTH TRACKING ==========

    void enter() {
        depth++;
        if (depth > maxDepth) {
            throw new ConversionException("Maximum nesting depth of " + maxDepth + " exceeded");
        }
    }

    void leave() {
        depth--;
    }

    int getDepth() {
        return depth;
    }

    int getMaxListLength() {
        return maxListLength;
    }

    // ========== LINES ==========

    /**
     * The best line for a node: its kind-specific line if positive, otherwise the wrapper line.
     * Zero and implausibly large values become {@code null}.
     */
    static Integer lineOf(ForeignNode node) {
        int line = node.getInnerLine() > 0 ? node.getInnerLine() : node.getLine();
        return lineOrNull(line);
    }

    static Integer lineOrNull(int line) {
        if (line <= 0 || line > MAX_PLAUSIBLE_LINE) {
            return null;
        }
        return line;
    }
}
