package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.CompoundCommand;
import me.christianrobert.shellast.ast.command.CoprocCommand;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.command.SubshellCommand;

/**
 * Static helper for groups, subshells, function definitions and coprocesses.
 */
public class WriteGrouping {

    public static String group(GroupCommand group, ShellCodeBuilder b) {
        return b.grouped(group.getBody()) + b.redirects(group.getRedirects());
    }

    /**
     * {@code ( BODY )}. The inner spaces keep {@code ( (x) )} from reading as {@code ((x))}.
     */
    public static String subshell(SubshellCommand subshell, ShellCodeBuilder b) {
        String body = b.visit(subshell.getBody());
        return "( " + body + b.closer() + ")" + b.redirects(subshell.getRedirects());
    }

    /**
     * {@code name() BODY}. A function body must be a compound command, so anything else is
     * wrapped in a group.
     */
    public static String functionDef(FunctionDefCommand function, ShellCodeBuilder b) {
        Command body = function.getBody();
        String text = body instanceof CompoundCommand ? b.visit(body) : b.grouped(body);
        return function.getName() + "() " + text;
    }

    /**
     * {@code coproc [NAME] BODY}. The name is left out when it is the default and the body is a
     * simple command, because the shell would read it as the command name.
     */
    public static String coproc(CoprocCommand coproc, ShellCodeBuilder b) {
        StringBuilder result = new StringBuilder("coproc ");
        String name = coproc.getName();
        boolean simpleBody = coproc.getBody() instanceof SimpleCommand;
        if (name != null && (!CoprocCommand.DEFAULT_NAME.equals(name) || !simpleBody)) {
            result.append(name).append(" ");
        }
        result.append(b.visit(coproc.getBody()));
        return result.toString();
    }
}
