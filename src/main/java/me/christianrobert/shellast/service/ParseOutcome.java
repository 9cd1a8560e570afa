package me.christianrobert.shellast.service;

import me.christianrobert.shellast.ast.Command;

/**
 * Result of a parse operation.
 * Contains either the canonical command tree or the failure kind and an error message.
 * Optionally includes a formatted tree representation for debugging.
 */
public class ParseOutcome {

    private final boolean success;
    private final Command command;
    private final ParseFailureKind failureKind;
    private final String errorMessage;
    private final String script;
    private final String commandTree;  // Optional formatted tree (null by default)

    private ParseOutcome(boolean success, Command command, ParseFailureKind failureKind, String errorMessage,
                         String script, String commandTree) {
        this.success = success;
        this.command = command;
        this.failureKind = failureKind;
        this.errorMessage = errorMessage;
        this.script = script;
        this.commandTree = commandTree;
    }

    /**
     * Creates a successful parse outcome.
     */
    public static ParseOutcome success(String script, Command command) {
        return new ParseOutcome(true, command, null, null, script, null);
    }

    /**
     * Creates a successful parse outcome with a formatted tree.
     */
    public static ParseOutcome successWithTree(String script, Command command, String commandTree) {
        return new ParseOutcome(true, command, null, null, script, commandTree);
    }

    /**
     * Creates a failed parse outcome.
     */
    public static ParseOutcome failure(String script, ParseFailureKind kind, String errorMessage) {
        if (kind == null) {
            throw new IllegalArgumentException("Failure kind cannot be null");
        }
        return new ParseOutcome(false, null, kind, errorMessage, script, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Command getCommand() {
        return command;
    }

    public ParseFailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getScript() {
        return script;
    }

    public String getCommandTree() {
        return commandTree;
    }

    public boolean hasCommandTree() {
        return commandTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "ParseOutcome{success=true, command=" + command.getClass().getSimpleName() +
                   (commandTree != null ? ", hasCommandTree=true" : "") + "}";
        } else {
            return "ParseOutcome{success=false, kind=" + failureKind + ", error='" + errorMessage + "'}";
        }
    }
}
