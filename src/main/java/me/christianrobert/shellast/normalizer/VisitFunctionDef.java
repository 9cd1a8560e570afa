package me.christianrobert.shellast.normalizer;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.foreign.ForeignNode;

/**
 * Static helper for function definitions.
 */
public class VisitFunctionDef {

    public static Command v(ForeignNode node, CommandTreeBuilder b) {
        Integer line = CommandTreeBuilder.lineOf(node);

        String name = node.getText(ForeignNode.TextRole.NAME);
        if (name == null) {
            throw new ConversionException("function definition is missing its name", "FUNCTION_DEF", line);
        }
        Command body = b.visit(node.getChild(ForeignNode.ChildRole.BODY));

        return new FunctionDefCommand(line, name, body, node.getText(ForeignNode.TextRole.SOURCE_FILE));
    }
}
