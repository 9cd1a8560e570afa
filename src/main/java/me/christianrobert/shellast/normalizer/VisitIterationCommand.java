package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ForCommand;
import me.christianrobert.shellast.ast.command.SelectCommand;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ForeignNodeKind;
import me.christianrobert.shellast.foreign.ForeignWordList;

import java.util.List;

/**
 * Static helper for {@code for NAME in WORDS} and {@code select NAME in WORDS}.
 *
 * <p>An absent word list means no {@code in} clause (iterate positional parameters) and maps
 * to {@code null}. A present list maps to a possibly empty list.
 */
public class VisitIterationCommand {

    public static Command v(ForeignNodeKind kind, ForeignNode node, CommandTreeBuilder b) {
        Integer line = CommandTreeBuilder.lineOf(node);

        String variable = node.getText(ForeignNode.TextRole.NAME);
        if (variable == null) {
            throw new ConversionException(kind + " loop is missing its variable name", kind.name(), line);
        }

        ForeignWordList mapList = node.getWordList(ForeignNode.WordListRole.MAP_LIST);
        List<String> words = mapList == null ? null : ForeignLists.texts(mapList, b.getMaxListLength());

        Command body = b.visit(node.getChild(ForeignNode.ChildRole.ACTION));
        List<Redirect> redirects = ForeignLists.redirects(node.getRedirects(), b.getMaxListLength());

        if (kind == ForeignNodeKind.SELECT) {
            return new SelectCommand(line, variable, words, body, redirects);
        }
        return new ForCommand(line, variable, words, body, redirects);
    }
}
