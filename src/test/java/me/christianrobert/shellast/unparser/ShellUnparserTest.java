package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.Command;
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
import me.christianrobert.shellast.ast.conditional.AndExpression;
import me.christianrobert.shellast.ast.conditional.BinaryTest;
import me.christianrobert.shellast.ast.conditional.GroupedExpression;
import me.christianrobert.shellast.ast.conditional.NotExpression;
import me.christianrobert.shellast.ast.conditional.OrExpression;
import me.christianrobert.shellast.ast.conditional.TermExpression;
import me.christianrobert.shellast.ast.conditional.UnaryTest;
import me.christianrobert.shellast.ast.element.CaseClause;
import me.christianrobert.shellast.ast.element.CaseClauseFlags;
import me.christianrobert.shellast.ast.element.ListOp;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;
import me.christianrobert.shellast.ast.element.RedirectType;
import me.christianrobert.shellast.ast.element.Word;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for writing command trees back as shell text.
 */
class ShellUnparserTest {

    private static SimpleCommand cmd(String... words) {
        return new SimpleCommand(Arrays.stream(words).map(Word::new).collect(Collectors.toList()));
    }

    private static SimpleCommand cmd(List<Redirect> redirects, String... words) {
        return new SimpleCommand(null, Arrays.stream(words).map(Word::new).collect(Collectors.toList()),
                redirects, List.of());
    }

    private static String write(Command command) {
        return ShellUnparser.serialize(command);
    }

    @Test
    void nullTree_isEmptyText() {
        assertEquals("", write(null));
    }

    // ========== SIMPLE COMMANDS AND REDIRECTS ==========

    @Test
    void simple_wordsJoinedBySpaces() {
        assertEquals("echo hello world", write(cmd("echo", "hello", "world")));
    }

    @Test
    void redirect_defaultFdIsElided() {
        Redirect redirect = new Redirect(RedirectType.OUTPUT, null, RedirectTarget.file("out.txt"));

        assertEquals("> out.txt", write(cmd(List.of(redirect))));
    }

    @Test
    void redirect_explicitFdIsPrinted() {
        Redirect redirect = new Redirect(RedirectType.OUTPUT, 2, RedirectTarget.file("out.txt"));

        assertEquals("2> out.txt", write(cmd(List.of(redirect))));
    }

    @Test
    void redirect_explicitDefaultFdIsElided() {
        Redirect redirect = new Redirect(RedirectType.INPUT, 0, RedirectTarget.file("in.txt"));

        assertEquals("sort < in.txt", write(cmd(List.of(redirect), "sort")));
    }

    @Test
    void redirect_afterWords() {
        Redirect out = new Redirect(RedirectType.APPEND, null, RedirectTarget.file("log"));
        Redirect err = new Redirect(RedirectType.DUP_OUTPUT, 2, RedirectTarget.fd(1));

        assertEquals("echo hi >> log 2>&1", write(cmd(List.of(out, err), "echo", "hi")));
    }

    @Test
    void redirect_duplicationWithDefaultFd() {
        Redirect redirect = new Redirect(RedirectType.DUP_INPUT, null, RedirectTarget.fd(3));

        assertEquals("read line <&3", write(cmd(List.of(redirect), "read", "line")));
    }

    @Test
    void redirect_duplicationToWord() {
        Redirect redirect = new Redirect(RedirectType.DUP_OUTPUT, null, RedirectTarget.file("$fd"));

        assertEquals("echo >&$fd", write(cmd(List.of(redirect), "echo")));
    }

    @Test
    void redirect_moveAppendsDash() {
        Redirect output = new Redirect(RedirectType.MOVE_OUTPUT, 3, RedirectTarget.fd(5));
        Redirect input = new Redirect(RedirectType.MOVE_INPUT, null, RedirectTarget.fd(4));

        assertEquals("cmd 3>&5- <&4-", write(cmd(List.of(output, input), "cmd")));
    }

    @Test
    void redirect_close() {
        Redirect redirect = new Redirect(RedirectType.CLOSE, 3, RedirectTarget.fd(-1));

        assertEquals("exec 3>&-", write(cmd(List.of(redirect), "exec")));
    }

    @Test
    void redirect_bothStreamsNeverTakeFd() {
        Redirect redirect = new Redirect(RedirectType.ERR_AND_OUT, 2, RedirectTarget.file("all.log"));
        Redirect append = new Redirect(RedirectType.APPEND_ERR_AND_OUT, null, RedirectTarget.file("all.log"));

        assertEquals("make &> all.log &>> all.log", write(cmd(List.of(redirect, append), "make")));
    }

    @Test
    void redirect_remainingOperators() {
        List<Redirect> redirects = List.of(
                new Redirect(RedirectType.HERE_STRING, null, RedirectTarget.file("\"$x\"")),
                new Redirect(RedirectType.INPUT_OUTPUT, null, RedirectTarget.file("dev")),
                new Redirect(RedirectType.CLOBBER, null, RedirectTarget.file("f")));

        assertEquals("cmd <<< \"$x\" <> dev >| f", write(cmd(redirects, "cmd")));
    }

    @Test
    void redirect_descriptorTargetOnFileOperatorIsDuplication() {
        Redirect redirect = new Redirect(RedirectType.OUTPUT, 2, RedirectTarget.fd(1));

        assertEquals("cmd 2>&1", write(cmd(List.of(redirect), "cmd")));
    }

    @Test
    void redirect_wordStartingWithOperatorCharacterIsSpaced() {
        Redirect redirect = new Redirect(RedirectType.DUP_OUTPUT, null, RedirectTarget.file(">odd"));

        assertEquals("cmd >& >odd", write(cmd(List.of(redirect), "cmd")));
    }

    // ========== ASSIGNMENTS ==========

    @Test
    void assignments_precedeCommandName() {
        SimpleCommand command = new SimpleCommand(null, List.of(new Word("make")), List.of(), List.of("CC=gcc", "V=1"));

        assertEquals("CC=gcc V=1 make", write(command));
    }

    @Test
    void assignments_onlyAssignment() {
        SimpleCommand command = new SimpleCommand(null, List.of(), List.of(), List.of("x=5"));

        assertEquals("x=5", write(command));
    }

    @Test
    void assignments_followDeclarationBuiltinAndFlags() {
        SimpleCommand local = new SimpleCommand(null, List.of(new Word("local"), new Word("-r")),
                List.of(), List.of("x=1"));
        SimpleCommand export = new SimpleCommand(null, List.of(new Word("export"), new Word("PATH")),
                List.of(), List.of("HOME=/root"));

        assertEquals("local -r x=1", write(local));
        assertEquals("export HOME=/root PATH", write(export));
    }

    // ========== PIPELINES AND LISTS ==========

    @Test
    void pipeline_stagesAndNegation() {
        assertEquals("ls | wc -l", write(new PipelineCommand(List.of(cmd("ls"), cmd("wc", "-l")), false)));
        assertEquals("! grep -q x file", write(new PipelineCommand(List.of(cmd("grep", "-q", "x", "file")), true)));
    }

    @Test
    void pipeline_listStageIsGrouped() {
        Command stage = new ListCommand(ListOp.AND, cmd("a"), cmd("b"));

        assertEquals("{ a && b; } | c", write(new PipelineCommand(List.of(stage, cmd("c")), false)));
    }

    @Test
    void list_operators() {
        assertEquals("a && b", write(new ListCommand(ListOp.AND, cmd("a"), cmd("b"))));
        assertEquals("a || b", write(new ListCommand(ListOp.OR, cmd("a"), cmd("b"))));
        assertEquals("a; b", write(new ListCommand(ListOp.SEMICOLON, cmd("a"), cmd("b"))));
        assertEquals("a\nb", write(new ListCommand(ListOp.NEWLINE, cmd("a"), cmd("b"))));
    }

    @Test
    void list_newlineAndSemicolonStayDistinct() {
        Command newline = new ListCommand(ListOp.NEWLINE, cmd("a"), cmd("b"));
        Command semicolon = new ListCommand(ListOp.SEMICOLON, cmd("a"), cmd("b"));

        assertNotEquals(write(semicolon), write(newline));
        assertEquals("{ a\nb; } && c", write(new ListCommand(ListOp.AND, newline, cmd("c"))));
        assertEquals("a &\nb", write(new ListCommand(ListOp.NEWLINE,
                new ListCommand(ListOp.BACKGROUND, cmd("a"), SimpleCommand.emptyPlaceholder()), cmd("b"))));
    }

    @Test
    void list_trailingBackground() {
        Command list = new ListCommand(ListOp.BACKGROUND, cmd("sleep", "10"), SimpleCommand.emptyPlaceholder());

        assertEquals("sleep 10 &", write(list));
    }

    @Test
    void list_backgroundFollowedByCommand() {
        assertEquals("server & client", write(new ListCommand(ListOp.BACKGROUND, cmd("server"), cmd("client"))));
    }

    @Test
    void list_noSemicolonAfterBackground() {
        Command background = new ListCommand(ListOp.BACKGROUND, cmd("a"), SimpleCommand.emptyPlaceholder());

        assertEquals("a & b", write(new ListCommand(ListOp.SEMICOLON, background, cmd("b"))));
    }

    @Test
    void list_chainedBackgrounds() {
        Command inner = new ListCommand(ListOp.BACKGROUND, cmd("b"), SimpleCommand.emptyPlaceholder());

        assertEquals("a & b &", write(new ListCommand(ListOp.BACKGROUND, cmd("a"), inner)));
    }

    @Test
    void list_leftAssociativeAndOrNeedsNoGroup() {
        Command andList = new ListCommand(ListOp.AND, cmd("a"), cmd("b"));

        assertEquals("a && b || c", write(new ListCommand(ListOp.OR, andList, cmd("c"))));
    }

    @Test
    void list_sequenceOnRightOfSemicolonNeedsNoGroup() {
        Command andList = new ListCommand(ListOp.AND, cmd("b"), cmd("c"));

        assertEquals("a; b && c", write(new ListCommand(ListOp.SEMICOLON, cmd("a"), andList)));
    }

    @Test
    void list_rightNestedAndOrIsGrouped() {
        Command orList = new ListCommand(ListOp.OR, cmd("b"), cmd("c"));

        assertEquals("a && { b || c; }", write(new ListCommand(ListOp.AND, cmd("a"), orList)));
    }

    @Test
    void list_sequenceUnderAndIsGrouped() {
        Command sequence = new ListCommand(ListOp.SEMICOLON, cmd("a"), cmd("b"));

        assertEquals("{ a; b; } && c", write(new ListCommand(ListOp.AND, sequence, cmd("c"))));
    }

    @Test
    void list_sequenceUnderBackgroundIsGrouped() {
        Command sequence = new ListCommand(ListOp.SEMICOLON, cmd("a"), cmd("b"));

        assertEquals("{ a; b; } &",
                write(new ListCommand(ListOp.BACKGROUND, sequence, SimpleCommand.emptyPlaceholder())));
    }

    // ========== IF ==========

    @Test
    void if_thenOnly() {
        assertEquals("if test -f x; then cat x; fi", write(new IfCommand(cmd("test", "-f", "x"), cmd("cat", "x"), null)));
    }

    @Test
    void if_withElse() {
        assertEquals("if a; then b; else c; fi", write(new IfCommand(cmd("a"), cmd("b"), cmd("c"))));
    }

    @Test
    void if_elifChainHasSingleFi() {
        Command tree = new IfCommand(cmd("a"), cmd("b"), new IfCommand(cmd("c"), cmd("d"), cmd("e")));

        assertEquals("if a; then b; elif c; then d; else e; fi", write(tree));
    }

    @Test
    void if_nestedIfWithRedirectsStaysNested() {
        Redirect redirect = new Redirect(RedirectType.OUTPUT, null, RedirectTarget.file("log"));
        Command inner = new IfCommand(null, cmd("c"), cmd("d"), null, List.of(redirect));
        Command tree = new IfCommand(cmd("a"), cmd("b"), inner);

        assertEquals("if a; then b; else if c; then d; fi > log; fi", write(tree));
    }

    @Test
    void if_backgroundBodyNeedsNoSemicolon() {
        Command body = new ListCommand(ListOp.BACKGROUND, cmd("job"), SimpleCommand.emptyPlaceholder());

        assertEquals("if a; then job & fi", write(new IfCommand(cmd("a"), body, null)));
    }

    // ========== LOOPS ==========

    @Test
    void for_withWords() {
        assertEquals("for i in a b; do echo $i; done", write(new ForCommand("i", List.of("a", "b"), cmd("echo", "$i"))));
    }

    @Test
    void for_withoutIn() {
        assertEquals("for arg; do echo $arg; done", write(new ForCommand("arg", null, cmd("echo", "$arg"))));
    }

    @Test
    void for_withEmptyIn() {
        assertEquals("for x in ; do echo; done", write(new ForCommand("x", List.of(), cmd("echo"))));
    }

    @Test
    void select_loop() {
        assertEquals("select opt in yes no; do break; done",
                write(new SelectCommand("opt", List.of("yes", "no"), cmd("break"))));
    }

    @Test
    void while_and_until() {
        assertEquals("while true; do work; done", write(new WhileCommand(cmd("true"), cmd("work"))));
        assertEquals("until ready; do sleep 1; done", write(new UntilCommand(cmd("ready"), cmd("sleep", "1"))));
    }

    @Test
    void loop_redirectsFollowDone() {
        Redirect redirect = new Redirect(RedirectType.INPUT, null, RedirectTarget.file("list.txt"));
        Command loop = new WhileCommand(null, cmd("read", "line"), cmd("echo", "$line"), List.of(redirect));

        assertEquals("while read line; do echo $line; done < list.txt", write(loop));
    }

    @Test
    void arithmeticFor() {
        assertEquals("for ((i=0; i<3; i++)); do echo $i; done",
                write(new ArithmeticForCommand("i=0", "i<3", "i++", cmd("echo", "$i"))));
    }

    // ========== CASE ==========

    @Test
    void case_terminators() {
        Command tree = new CaseCommand("$x", List.of(
                new CaseClause(List.of("p"), cmd("a"), CaseClauseFlags.fallthrough()),
                new CaseClause(List.of("q", "r"), cmd("b"), null),
                new CaseClause(List.of("*"), cmd("c"), CaseClauseFlags.testNext())));

        assertEquals("case $x in p) a ;& q|r) b ;; *) c ;;& esac", write(tree));
    }

    @Test
    void case_emptyAction() {
        Command tree = new CaseCommand("$x", List.of(new CaseClause(List.of("skip"), null, null)));

        assertEquals("case $x in skip) ;; esac", write(tree));
    }

    @Test
    void case_noClauses() {
        assertEquals("case $x in esac", write(new CaseCommand("$x", List.of())));
    }

    // ========== GROUPING ==========

    @Test
    void group_body() {
        assertEquals("{ a; b; }", write(new GroupCommand(new ListCommand(ListOp.SEMICOLON, cmd("a"), cmd("b")))));
    }

    @Test
    void group_withRedirects() {
        Redirect redirect = new Redirect(RedirectType.OUTPUT, null, RedirectTarget.file("out"));

        assertEquals("{ a; } > out", write(new GroupCommand(null, cmd("a"), List.of(redirect))));
    }

    @Test
    void subshell_innerSpacesPreventArithmeticReading() {
        assertEquals("( ( x ) )", write(new SubshellCommand(new SubshellCommand(cmd("x")))));
    }

    @Test
    void function_withGroupBody() {
        assertEquals("greet() { echo hi; }", write(new FunctionDefCommand("greet", new GroupCommand(cmd("echo", "hi")))));
    }

    @Test
    void function_simpleBodyIsWrapped() {
        assertEquals("f() { echo; }", write(new FunctionDefCommand("f", cmd("echo"))));
    }

    @Test
    void coproc_defaultNameWithSimpleBodyIsOmitted() {
        assertEquals("coproc cat", write(new CoprocCommand(CoprocCommand.DEFAULT_NAME, cmd("cat"))));
        assertEquals("coproc cat", write(new CoprocCommand(null, cmd("cat"))));
    }

    @Test
    void coproc_namedCompoundBody() {
        assertEquals("coproc worker { cat; }", write(new CoprocCommand("worker", new GroupCommand(cmd("cat")))));
        assertEquals("coproc COPROC { cat; }", write(new CoprocCommand("COPROC", new GroupCommand(cmd("cat")))));
    }

    // ========== ARITHMETIC AND CONDITIONALS ==========

    @Test
    void arithmetic() {
        assertEquals("((x += 1))", write(new ArithmeticCommand("x += 1")));
    }

    @Test
    void conditional_tests() {
        Command tree = new ConditionalCommand(new AndExpression(
                new UnaryTest("-f", "file"),
                new NotExpression(new BinaryTest("==", "$a", "b*"))));

        assertEquals("[[ -f file && ! $a == b* ]]", write(tree));
    }

    @Test
    void conditional_orUnderAndIsParenthesized() {
        Command tree = new ConditionalCommand(new AndExpression(
                new OrExpression(new TermExpression("$x"), new TermExpression("$y")),
                new TermExpression("$z")));

        assertEquals("[[ ( $x || $y ) && $z ]]", write(tree));
    }

    @Test
    void conditional_notOfCompoundIsParenthesized() {
        Command tree = new ConditionalCommand(new NotExpression(
                new AndExpression(new TermExpression("a"), new TermExpression("b"))));

        assertEquals("[[ ! ( a && b ) ]]", write(tree));
    }

    @Test
    void conditional_groupedExpression() {
        Command tree = new ConditionalCommand(new GroupedExpression(new UnaryTest("-n", "$v")));

        assertEquals("[[ ( -n $v ) ]]", write(tree));
    }
}
