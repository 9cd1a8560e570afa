package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.element.CaseClause;
import me.christianrobert.shellast.ast.element.CaseClauseFlags;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ForeignPatternList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for case statements.
 *
 * <p>Clause terminators: flag 0 is the ordinary {@code ;;} and maps to {@code null} flags,
 * 0x01 is {@code ;&}, 0x02 is {@code ;;&}.
 */
public class VisitCaseCommand {

    private static final Logger log = LoggerFactory.getLogger(VisitCaseCommand.class);

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        Integer line = CommandTreeBuilder.lineOf(node);

        String subject = node.getText(ForeignNode.TextRole.SUBJECT);
        if (subject == null) {
            throw new ConversionException("case statement is missing its subject word", "CASE", line);
        }

        List<CaseClause> clauses = new ArrayList<>();
        int count = 0;
        for (ForeignPatternList cell = node.getPatterns(); cell != null; cell = cell.getNext()) {
            if (++count > b.getMaxListLength()) {
                log.debug("Case clause list truncated after {} entries", b.getMaxListLength());
                break;
            }
            List<String> patterns = ForeignLists.texts(cell.getPatterns(), b.getMaxListLength());
            Command action = b.visitOptional(cell.getAction());
            clauses.add(new CaseClause(patterns, action, CaseClauseFlags.fromBits(cell.getFlags())));
        }

        return new CaseCommand(line, subject, clauses, ForeignLists.redirects(node.getRedirects(), b.getMaxListLength()));
    }
}
