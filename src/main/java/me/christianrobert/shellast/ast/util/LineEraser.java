package me.christianrobert.shellast.ast.util;

import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.CommandVisitor;
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
import me.christianrobert.shellast.ast.element.CaseClause;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces a copy of a command tree with every {@code line} cleared.
 *
 * <p>Two trees are "equal modulo line" when their erased copies are equal.
 */
public final class LineEraser implements CommandVisitor<Command> {

    private static final LineEraser INSTANCE = new LineEraser();

    private LineEraser() {
    }

    public static Command erase(Command command) {
        return command == null ? null : command.accept(INSTANCE);
    }

    public static boolean equalIgnoringLines(Command a, Command b) {
        if (a == null || b == null) {
            return a == b;
        }
        return erase(a).equals(erase(b));
    }

    private Command e(Command command) {
        return command == null ? null : command.accept(this);
    }

    @Override
    public Command visitSimple(SimpleCommand c) {
        return new SimpleCommand(null, c.getWords(), c.getRedirects(), c.getAssignments());
    }

    @Override
    public Command visitPipeline(PipelineCommand c) {
        List<Command> stages = new ArrayList<>(c.getCommands().size());
        for (Command stage : c.getCommands()) {
            stages.add(e(stage));
        }
        return new PipelineCommand(null, stages, c.isNegated());
    }

    @Override
    public Command visitList(ListCommand c) {
        return new ListCommand(null, c.getOp(), e(c.getLeft()), e(c.getRight()));
    }

    @Override
    public Command visitFor(ForCommand c) {
        return new ForCommand(null, c.getVariable(), c.getWords(), e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitWhile(WhileCommand c) {
        return new WhileCommand(null, e(c.getTest()), e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitUntil(UntilCommand c) {
        return new UntilCommand(null, e(c.getTest()), e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitIf(IfCommand c) {
        return new IfCommand(null, e(c.getCondition()), e(c.getThenBranch()), e(c.getElseBranch()),
                c.getRedirects());
    }

    @Override
    public Command visitCase(CaseCommand c) {
        List<CaseClause> clauses = new ArrayList<>(c.getClauses().size());
        for (CaseClause clause : c.getClauses()) {
            clauses.add(new CaseClause(clause.getPatterns(), e(clause.getAction()), clause.getFlags()));
        }
        return new CaseCommand(null, c.getWord(), clauses, c.getRedirects());
    }

    @Override
    public Command visitSelect(SelectCommand c) {
        return new SelectCommand(null, c.getVariable(), c.getWords(), e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitGroup(GroupCommand c) {
        return new GroupCommand(null, e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitSubshell(SubshellCommand c) {
        return new SubshellCommand(null, e(c.getBody()), c.getRedirects());
    }

    @Override
    public Command visitFunctionDef(FunctionDefCommand c) {
        return new FunctionDefCommand(null, c.getName(), e(c.getBody()), c.getSourceFile());
    }

    @Override
    public Command visitArithmetic(ArithmeticCommand c) {
        return new ArithmeticCommand(null, c.getExpression(), c.getRedirects());
    }

    @Override
    public Command visitArithmeticFor(ArithmeticForCommand c) {
        return new ArithmeticForCommand(null, c.getInit(), c.getTest(), c.getStep(), e(c.getBody()),
                c.getRedirects());
    }

    @Override
    public Command visitConditional(ConditionalCommand c) {
        return new ConditionalCommand(null, c.getExpr(), c.getRedirects());
    }

    @Override
    public Command visitCoproc(CoprocCommand c) {
        return new CoprocCommand(null, c.getName(), e(c.getBody()));
    }
}
