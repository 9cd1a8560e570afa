package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.Word;
import me.christianrobert.shellast.foreign.ForeignFlags;
import me.christianrobert.shellast.foreign.ForeignNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for converting simple commands.
 *
 * <p>Words flagged as assignments are split off into the assignment list, keeping the
 * relative order of both groups. Redirects recorded inside the simple command come first,
 * followed by any attached to the wrapper.
 */
public class VisitSimpleCommand {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        List<Word> all = ForeignLists.words(node.getWordList(ForeignNode.WordListRole.WORDS), b.getMaxListLength());

        List<Word> words = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        for (Word word : all) {
            if (ForeignFlags.isSet(word.getFlags(), ForeignFlags.W_ASSIGNMENT)) {
                assignments.add(word.getText());
            } else {
                words.add(word);
            }
        }

        List<Redirect> redirects = new ArrayList<>(ForeignLists.redirects(node.getInnerRedirects(), b.getMaxListLength()));
        redirects.addAll(ForeignLists.redirects(node.getRedirects(), b.getMaxListLength()));

        return new SimpleCommand(CommandTreeBuilder.lineOf(node), words, redirects, assignments);
    }
}
