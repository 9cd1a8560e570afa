package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;

/**
 * Turns a canonical command tree back into shell source text.
 *
 * <p>The output is semantically equivalent to the tree, not a byte-for-byte copy of the
 * original script: parsing the output again yields an equal tree, ignoring line numbers.
 * Here-document bodies are written after the logical line that opened them.
 */
public final class ShellUnparser {

    private ShellUnparser() {
    }

    /**
     * Serializes a command tree. Total: every tree produces some text.
     *
     * @param command Root of the tree, may be null (yields an empty string)
     * @return Shell source text
     */
    public static String serialize(Command command) {
        if (command == null) {
            return "";
        }
        ShellCodeBuilder b = new ShellCodeBuilder();
        String body = b.visit(command);
        return body + b.flushHereDocs();
    }
}
