package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ArithmeticCommand;
import me.christianrobert.shellast.ast.command.ArithmeticForCommand;
import me.christianrobert.shellast.foreign.ForeignNode;

/**
 * Static helper for {@code (( ))} commands and C-style for loops.
 * Arithmetic text is kept raw: the word lists are joined with single spaces.
 */
public class VisitArithmetic {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        String expression = ForeignLists.joined(node.getWordList(ForeignNode.WordListRole.EXPRESSION), b.getMaxListLength());
        return new ArithmeticCommand(CommandTreeBuilder.lineOf(node), expression,
                ForeignLists.redirects(node.getRedirects(), b.getMaxListLength()));
    }

    public static Command forLoop(ForeignNode node, CommandTreeBuilder b) {
        int max = b.getMaxListLength();
        String init = ForeignLists.joined(node.getWordList(ForeignNode.WordListRole.INIT), max);
        String test = ForeignLists.joined(node.getWordList(ForeignNode.WordListRole.ARITH_TEST), max);
        String step = ForeignLists.joined(node.getWordList(ForeignNode.WordListRole.STEP), max);
        Command body = b.visit(node.getChild(ForeignNode.ChildRole.ACTION));

        return new ArithmeticForCommand(CommandTreeBuilder.lineOf(node), init, test, step, body,
                ForeignLists.redirects(node.getRedirects(), max));
    }
}
