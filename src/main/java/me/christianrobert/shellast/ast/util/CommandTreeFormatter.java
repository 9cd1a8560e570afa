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
import me.christianrobert.shellast.ast.command.WordIterationCommand;
import me.christianrobert.shellast.ast.element.CaseClause;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;
import me.christianrobert.shellast.ast.element.Word;
import me.christianrobert.shellast.unparser.ConditionalExprWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats canonical command trees into human-readable, indented text.
 *
 * <p>Useful for debugging how a script was normalized.</p>
 *
 * <p>Example output for {@code if test -f x; then cat x > out; fi} (with lines):</p>
 * <pre>
 * if @1
 *   simple [test -f x] @1
 *   simple [cat x] @1
 *     redirect output 1 -&gt; out
 * </pre>
 */
public class CommandTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a command tree into human-readable text, including line numbers.
   *
   * @param command Root of the tree
   * @return Formatted string representation
   */
  public static String format(Command command) {
    return format(command, true);
  }

  /**
   * Formats a command tree into human-readable text.
   *
   * @param command Root of the tree
   * @param showLines Whether to append {@code @line} markers
   * @return Formatted string representation
   */
  public static String format(Command command, boolean showLines) {
    if (command == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(command, 0, sb, showLines);
    return sb.toString();
  }

  private static void formatNode(Command command, int depth, StringBuilder sb, boolean showLines) {
    indent(depth, sb);
    sb.append(command.accept(LABELS));
    if (showLines && command.getLine() != null) {
      sb.append(" @").append(command.getLine());
    }
    sb.append("\n");

    for (Redirect redirect : command.getRedirects()) {
      indent(depth + 1, sb);
      sb.append(describe(redirect)).append("\n");
    }

    if (command instanceof CaseCommand) {
      // Clauses are not commands; show them as intermediate rows
      for (CaseClause clause : ((CaseCommand) command).getClauses()) {
        indent(depth + 1, sb);
        sb.append("clause [").append(escapeAndTruncate(String.join("|", clause.getPatterns())))
            .append("] ").append(clause.terminator()).append("\n");
        if (clause.getAction() != null) {
          formatNode(clause.getAction(), depth + 2, sb, showLines);
        }
      }
      return;
    }

    for (Command child : command.children()) {
      formatNode(child, depth + 1, sb, showLines);
    }
  }

  private static void indent(int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  private static String describe(Redirect redirect) {
    StringBuilder sb = new StringBuilder("redirect ");
    sb.append(redirect.getDirection().name().toLowerCase());
    sb.append(" ").append(redirect.effectiveSourceFd()).append(" -> ");
    RedirectTarget target = redirect.getTarget();
    if (target instanceof RedirectTarget.Fd) {
      sb.append("&").append(((RedirectTarget.Fd) target).getFd());
    } else {
      sb.append(escapeAndTruncate(((RedirectTarget.File) target).getName()));
    }
    if (redirect.getHereDocDelimiter() != null) {
      sb.append(" (delimiter ").append(redirect.getHereDocDelimiter()).append(")");
    }
    return sb.toString();
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }

  private static String bracket(String text) {
    return " [" + escapeAndTruncate(text) + "]";
  }

  private static String iteration(String keyword, WordIterationCommand command) {
    String words = command.getWords() == null ? "\"$@\"" : String.join(" ", command.getWords());
    return keyword + bracket(command.getVariable() + " in " + words);
  }

  private static final CommandVisitor<String> LABELS = new CommandVisitor<>() {

    @Override
    public String visitSimple(SimpleCommand command) {
      if (command.isEmptyPlaceholder()) {
        return "simple (empty)";
      }
      List<String> parts = new ArrayList<>(command.getAssignments());
      for (Word word : command.getWords()) {
        parts.add(word.getText());
      }
      return "simple" + bracket(String.join(" ", parts));
    }

    @Override
    public String visitPipeline(PipelineCommand command) {
      return command.isNegated() ? "pipeline (negated)" : "pipeline";
    }

    @Override
    public String visitList(ListCommand command) {
      return "list [" + command.getOp().name().toLowerCase() + "]";
    }

    @Override
    public String visitFor(ForCommand command) {
      return iteration("for", command);
    }

    @Override
    public String visitWhile(WhileCommand command) {
      return "while";
    }

    @Override
    public String visitUntil(UntilCommand command) {
      return "until";
    }

    @Override
    public String visitIf(IfCommand command) {
      return "if";
    }

    @Override
    public String visitCase(CaseCommand command) {
      return "case" + bracket(command.getWord());
    }

    @Override
    public String visitSelect(SelectCommand command) {
      return iteration("select", command);
    }

    @Override
    public String visitGroup(GroupCommand command) {
      return "group";
    }

    @Override
    public String visitSubshell(SubshellCommand command) {
      return "subshell";
    }

    @Override
    public String visitFunctionDef(FunctionDefCommand command) {
      return "function_def" + bracket(command.getName());
    }

    @Override
    public String visitArithmetic(ArithmeticCommand command) {
      return "arithmetic" + bracket(command.getExpression());
    }

    @Override
    public String visitArithmeticFor(ArithmeticForCommand command) {
      return "arithmetic_for" + bracket(command.getInit() + "; " + command.getTest() + "; " + command.getStep());
    }

    @Override
    public String visitConditional(ConditionalCommand command) {
      return "conditional" + bracket(ConditionalExprWriter.write(command.getExpr()));
    }

    @Override
    public String visitCoproc(CoprocCommand command) {
      return command.getName() != null ? "coproc" + bracket(command.getName()) : "coproc";
    }
  };
}
