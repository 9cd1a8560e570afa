package me.christianrobert.shellast.ast;

import me.christianrobert.shellast.ast.command.ArithmeticCommand;
import me.christianrobert.shellast.ast.command.ArithmeticForCommand;
import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.command.ConditionalCommand;
import me.christianrobert.shellast.ast.command.CoprocCommand;
import me.christianrobert.shellast.ast.command.ForCommand;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.IfCommand;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.command.SelectCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.command.SubshellCommand;
import me.christianrobert.shellast.ast.command.UntilCommand;
import me.christianrobert.shellast.ast.command.WhileCommand;

/**
 * Visitor over the {@link Command} variants.
 *
 * @param <R> result type
 */
public interface CommandVisitor<R> {

    R visitSimple(SimpleCommand command);

    R visitPipeline(PipelineCommand command);

    R visitList(ListCommand command);

    R visitFor(ForCommand command);

    R visitWhile(WhileCommand command);

    R visitUntil(UntilCommand command);

    R visitIf(IfCommand command);

    R visitCase(CaseCommand command);

    R visitSelect(SelectCommand command);

    R visitGroup(GroupCommand command);

    R visitSubshell(SubshellCommand command);

    R visitFunctionDef(FunctionDefCommand command);

    R visitArithmetic(ArithmeticCommand command);

    R visitArithmeticFor(ArithmeticForCommand command);

    R visitConditional(ConditionalCommand command);

    R visitCoproc(CoprocCommand command);
}
