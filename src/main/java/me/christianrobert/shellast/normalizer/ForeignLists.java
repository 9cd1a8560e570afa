package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;
import me.christianrobert.shellast.ast.element.RedirectType;
import me.christianrobert.shellast.ast.element.Word;
import me.christianrobert.shellast.foreign.ForeignRedirect;
import me.christianrobert.shellast.foreign.ForeignWord;
import me.christianrobert.shellast.foreign.ForeignWordList;
import me.christianrobert.shellast.foreign.RedirectInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers for reading the foreign linked lists (words and redirects).
 *
 * <p>Every traversal stops after {@code maxLength} cells, so a cyclic list terminates.
 */
final class ForeignLists {

    private static final Logger log = LoggerFactory.getLogger(ForeignLists.class);

    private ForeignLists() {
    }

    // ========== WORDS ==========

    static List<Word> words(ForeignWordList list, int maxLength) {
        List<Word> words = new ArrayList<>();
        int count = 0;
        for (ForeignWordList cell = list; cell != null; cell = cell.getNext()) {
            if (++count > maxLength) {
                log.debug("Word list truncated after {} entries", maxLength);
                break;
            }
            ForeignWord word = cell.getWord();
            if (word != null) {
                words.add(new Word(textOf(word), word.getFlags()));
            }
        }
        return words;
    }

    static List<String> texts(ForeignWordList list, int maxLength) {
        List<String> texts = new ArrayList<>();
        for (Word word : words(list, maxLength)) {
            texts.add(word.getText());
        }
        return texts;
    }

    /**
     * Word texts joined by single spaces; empty for an absent list.
     */
    static String joined(ForeignWordList list, int maxLength) {
        return String.join(" ", texts(list, maxLength));
    }

    static String textOf(ForeignWord word) {
        if (word == null || word.getText() == null) {
            return "";
        }
        return word.getText();
    }

    // ========== REDIRECTS ==========

    static List<Redirect> redirects(ForeignRedirect list, int maxLength) {
        List<Redirect> redirects = new ArrayList<>();
        int count = 0;
        for (ForeignRedirect cell = list; cell != null; cell = cell.getNext()) {
            if (++count > maxLength) {
                log.debug("Redirect list truncated after {} entries", maxLength);
                break;
            }
            redirects.add(redirect(cell));
        }
        return redirects;
    }

    static Redirect redirect(ForeignRedirect cell) {
        RedirectInstruction instruction = RedirectInstruction.fromTag(cell.getInstruction());
        RedirectType type = typeOf(instruction);

        int fd = cell.getRedirectorFd();
        Integer sourceFd = (fd < 0 || fd == type.getDefaultFd()) ? null : fd;

        return new Redirect(type, sourceFd, targetOf(instruction, cell), cell.getHereDocDelimiter());
    }

    static RedirectType typeOf(RedirectInstruction instruction) {
        if (instruction == null) {
            return RedirectType.OUTPUT;
        }
        return switch (instruction) {
            case OUTPUT_DIRECTION -> RedirectType.OUTPUT;
            case INPUT_DIRECTION, INPUTA_DIRECTION -> RedirectType.INPUT;
            case APPENDING_TO -> RedirectType.APPEND;
            case READING_UNTIL, DEBLANK_READING_UNTIL -> RedirectType.HERE_DOC;
            case READING_STRING -> RedirectType.HERE_STRING;
            case DUPLICATING_INPUT, DUPLICATING_INPUT_WORD -> RedirectType.DUP_INPUT;
            case DUPLICATING_OUTPUT, DUPLICATING_OUTPUT_WORD -> RedirectType.DUP_OUTPUT;
            case CLOSE_THIS -> RedirectType.CLOSE;
            case ERR_AND_OUT -> RedirectType.ERR_AND_OUT;
            case INPUT_OUTPUT -> RedirectType.INPUT_OUTPUT;
            case OUTPUT_FORCE -> RedirectType.CLOBBER;
            case MOVE_INPUT, MOVE_INPUT_WORD -> RedirectType.MOVE_INPUT;
            case MOVE_OUTPUT, MOVE_OUTPUT_WORD -> RedirectType.MOVE_OUTPUT;
            case APPEND_ERR_AND_OUT -> RedirectType.APPEND_ERR_AND_OUT;
        };
    }

    private static RedirectTarget targetOf(RedirectInstruction instruction, ForeignRedirect cell) {
        if (instruction != null) {
            switch (instruction) {
                case DUPLICATING_INPUT:
                case DUPLICATING_OUTPUT:
                case MOVE_INPUT:
                case MOVE_OUTPUT:
                    return RedirectTarget.fd(cell.getRedirecteeFd());
                case CLOSE_THIS:
                    return RedirectTarget.fd(-1);
                default:
                    break;
            }
        }
        return RedirectTarget.file(textOf(cell.getRedirecteeWord()));
    }
}
