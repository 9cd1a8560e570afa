package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;
import me.christianrobert.shellast.ast.element.RedirectType;

/**
 * Static helper for writing a single redirect.
 *
 * <p>Layout:
 * <pre>
 * > out.txt      2> err.txt     &>> all.log
 * 2>&1           >&$fd          3<&0-
 * 2>&-           <<EOF          <<< "$x"
 * </pre>
 *
 * <p>A source fd equal to the operator's default is omitted. File targets are separated from
 * the operator by a space. Duplication targets are attached, unless a file target starts with
 * {@code <} or {@code >}.
 */
public class WriteRedirect {

    public static String v(Redirect redirect, ShellCodeBuilder b) {
        RedirectType type = redirect.getDirection();
        String fd = sourceFdPrefix(redirect);
        RedirectTarget target = redirect.getTarget();

        return switch (type) {
            case HERE_DOC -> {
                b.addPendingHereDoc(redirect);
                yield fd + "<<" + ShellCodeBuilder.delimiterOf(redirect);
            }
            case CLOSE -> fd + ">&-";
            case DUP_INPUT, DUP_OUTPUT -> fd + type.getOperator() + attached(target);
            case MOVE_INPUT, MOVE_OUTPUT -> fd + type.getOperator() + attached(target) + "-";
            default -> {
                if (target instanceof RedirectTarget.Fd) {
                    // A numeric target on a file operator can only mean duplication
                    String dup = type.isInputLike() ? "<&" : ">&";
                    yield fd + dup + ((RedirectTarget.Fd) target).getFd();
                }
                yield fd + type.getOperator() + " " + ((RedirectTarget.File) target).getName();
            }
        };
    }

    static String sourceFdPrefix(Redirect redirect) {
        Integer fd = redirect.getSourceFd();
        if (fd == null || fd == redirect.defaultFd() || redirect.getDirection().isBothStreams()) {
            return "";
        }
        return String.valueOf(fd);
    }

    private static String attached(RedirectTarget target) {
        if (target instanceof RedirectTarget.Fd) {
            return String.valueOf(((RedirectTarget.Fd) target).getFd());
        }
        String name = ((RedirectTarget.File) target).getName();
        if (name.startsWith("<") || name.startsWith(">")) {
            return " " + name;
        }
        return name;
    }
}
