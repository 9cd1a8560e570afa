package me.christianrobert.shellast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.CaseCommand;
import me.christianrobert.shellast.ast.command.ConditionalCommand;
import me.christianrobert.shellast.ast.command.ForCommand;
import me.christianrobert.shellast.ast.command.FunctionDefCommand;
import me.christianrobert.shellast.ast.command.GroupCommand;
import me.christianrobert.shellast.ast.command.IfCommand;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.PipelineCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.conditional.AndExpression;
import me.christianrobert.shellast.ast.conditional.NotExpression;
import me.christianrobert.shellast.ast.conditional.TermExpression;
import me.christianrobert.shellast.ast.conditional.UnaryTest;
import me.christianrobert.shellast.ast.element.CaseClause;
import me.christianrobert.shellast.ast.element.CaseClauseFlags;
import me.christianrobert.shellast.ast.element.ListOp;
import me.christianrobert.shellast.ast.element.Redirect;
import me.christianrobert.shellast.ast.element.RedirectTarget;
import me.christianrobert.shellast.ast.element.RedirectType;
import me.christianrobert.shellast.ast.element.Word;
import me.christianrobert.shellast.ast.element.WordFlags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON interchange format: discriminants, field names, omitted fields and
 * error reporting.
 */
class CommandJsonCodecTest {

    private CommandJsonCodec codec;
    private final ObjectMapper reader = new ObjectMapper();

    @BeforeEach
    void setUp() {
        codec = new CommandJsonCodec();
    }

    private JsonNode encode(Command command) throws Exception {
        return reader.readTree(codec.toJson(command));
    }

    // ========== ENCODING ==========

    @Test
    void simple_fieldsAndDiscriminant() throws Exception {
        SimpleCommand command = new SimpleCommand(3, List.of(new Word("echo"), new Word("\"$x\"", WordFlags.QUOTED)),
                List.of(), List.of());

        JsonNode json = encode(command);

        assertEquals("simple", json.get("type").asText());
        assertEquals(3, json.get("line").asInt());
        assertEquals("echo", json.get("words").get(0).get("word").asText());
        assertFalse(json.get("words").get(0).has("flags"), "Zero flags are omitted");
        assertEquals(WordFlags.QUOTED, json.get("words").get(1).get("flags").asInt());
    }

    @Test
    void unknownLine_andEmptyAssignments_areOmitted() throws Exception {
        JsonNode json = encode(new SimpleCommand(List.of(new Word("ls"))));

        assertFalse(json.has("line"));
        assertFalse(json.has("assignments"));
    }

    @Test
    void assignments_areWrittenWhenPresent() throws Exception {
        JsonNode json = encode(new SimpleCommand(null, List.of(), List.of(), List.of("A=1")));

        assertEquals("A=1", json.get("assignments").get(0).asText());
    }

    @Test
    void redirectTarget_isTaggedUnion() throws Exception {
        Redirect toFile = new Redirect(RedirectType.OUTPUT, null, RedirectTarget.file("out.txt"));
        Redirect toFd = new Redirect(RedirectType.DUP_OUTPUT, 2, RedirectTarget.fd(1));

        JsonNode redirects = encode(new SimpleCommand(null, List.of(new Word("cmd")), List.of(toFile, toFd), List.of()))
                .get("redirects");

        assertEquals("output", redirects.get(0).get("direction").asText());
        assertEquals("out.txt", redirects.get(0).get("target").get("file").asText());
        assertFalse(redirects.get(0).has("source_fd"), "Default fd is omitted");
        assertEquals("dup_output", redirects.get(1).get("direction").asText());
        assertEquals(2, redirects.get(1).get("source_fd").asInt());
        assertEquals(1, redirects.get(1).get("target").get("fd").asInt());
    }

    @Test
    void hereDoc_carriesDelimiter() throws Exception {
        Redirect hereDoc = Redirect.hereDoc(null, "hi\n", "EOF");

        JsonNode redirect = encode(new SimpleCommand(null, List.of(new Word("cat")), List.of(hereDoc), List.of()))
                .get("redirects").get(0);

        assertEquals("here_doc", redirect.get("direction").asText());
        assertEquals("EOF", redirect.get("here_doc_eof").asText());
        assertEquals("hi\n", redirect.get("target").get("file").asText());
    }

    @Test
    void list_opNames() throws Exception {
        SimpleCommand a = new SimpleCommand(List.of(new Word("a")));
        SimpleCommand b = new SimpleCommand(List.of(new Word("b")));

        assertEquals("and", encode(new ListCommand(ListOp.AND, a, b)).get("op").asText());
        assertEquals("or", encode(new ListCommand(ListOp.OR, a, b)).get("op").asText());
        assertEquals("semi", encode(new ListCommand(ListOp.SEMICOLON, a, b)).get("op").asText());
        assertEquals("amp", encode(new ListCommand(ListOp.BACKGROUND, a, b)).get("op").asText());
        assertEquals("newline", encode(new ListCommand(ListOp.NEWLINE, a, b)).get("op").asText());
    }

    @Test
    void pipeline_negatedOnlyWhenSet() throws Exception {
        SimpleCommand a = new SimpleCommand(List.of(new Word("a")));

        assertFalse(encode(new PipelineCommand(List.of(a), false)).has("negated"));
        assertTrue(encode(new PipelineCommand(List.of(a), true)).get("negated").asBoolean());
    }

    @Test
    void compound_emptyRedirectsAndMissingElseAreOmitted() throws Exception {
        SimpleCommand a = new SimpleCommand(List.of(new Word("a")));

        JsonNode json = encode(new IfCommand(a, a, null));

        assertEquals("if", json.get("type").asText());
        assertFalse(json.has("else_branch"));
        assertFalse(json.has("redirects"));
        assertEquals("simple", json.get("then_branch").get("type").asText());
    }

    @Test
    void for_withoutWordsOmitsWords() throws Exception {
        SimpleCommand body = new SimpleCommand(List.of(new Word("echo")));

        assertFalse(encode(new ForCommand("i", null, body)).has("words"));
        assertTrue(encode(new ForCommand("i", List.of(), body)).get("words").isArray());
    }

    @Test
    void conditional_usesCondType() throws Exception {
        Command command = new ConditionalCommand(new AndExpression(
                new UnaryTest("-f", "x"), new NotExpression(new TermExpression("$y"))));

        JsonNode expr = encode(command).get("expr");

        assertEquals("and", expr.get("cond_type").asText());
        assertEquals("unary", expr.get("left").get("cond_type").asText());
        assertEquals("not", expr.get("right").get("cond_type").asText());
        assertEquals("term", expr.get("right").get("expr").get("cond_type").asText());
    }

    @Test
    void functionDef_discriminant() throws Exception {
        Command command = new FunctionDefCommand("f", new GroupCommand(new SimpleCommand(List.of(new Word("x")))));

        JsonNode json = encode(command);

        assertEquals("function_def", json.get("type").asText());
        assertEquals("group", json.get("body").get("type").asText());
        assertFalse(json.has("source_file"));
    }

    @Test
    void toJson_prettyIsIndented() {
        String json = codec.toJson(new SimpleCommand(List.of(new Word("ls"))), true);

        assertTrue(json.contains("\n"));
    }

    @Test
    void toJson_nullCommandRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.toJson(null));
    }

    // ========== DECODING ==========

    @Test
    void decode_encodedTreeIsEqual() {
        SimpleCommand action = new SimpleCommand(List.of(new Word("echo"), new Word("one")));
        Command tree = new CaseCommand(5, "$x", List.of(
                new CaseClause(List.of("a", "b"), action, CaseClauseFlags.fallthrough()),
                new CaseClause(List.of("*"), null, null)),
                List.of(new Redirect(RedirectType.OUTPUT, 2, RedirectTarget.file("log"))));

        assertEquals(tree, codec.fromJson(codec.toJson(tree)));
    }

    @Test
    void decode_handWrittenJson() {
        String json = "{\"type\":\"list\",\"op\":\"and\","
                + "\"left\":{\"type\":\"simple\",\"words\":[{\"word\":\"make\"}]},"
                + "\"right\":{\"type\":\"simple\",\"words\":[{\"word\":\"echo\"},{\"word\":\"ok\"}],"
                + "\"redirects\":[{\"direction\":\"dup_output\",\"source_fd\":2,\"target\":{\"fd\":1}}]}}";

        Command command = codec.fromJson(json);

        ListCommand list = (ListCommand) command;
        assertEquals(ListOp.AND, list.getOp());
        assertNull(list.getLine());
        Redirect redirect = list.getRight().getRedirects().get(0);
        assertEquals(new Redirect(RedirectType.DUP_OUTPUT, 2, RedirectTarget.fd(1)), redirect);
        assertTrue(((SimpleCommand) list.getLeft()).getAssignments().isEmpty());
    }

    @Test
    void decode_unknownPropertiesAreIgnored() {
        Command command = codec.fromJson("{\"type\":\"simple\",\"words\":[],\"comment\":\"x\"}");

        assertTrue(command instanceof SimpleCommand);
    }

    @Test
    void decode_emptyInputRejected() {
        assertThrows(InterchangeException.class, () -> codec.fromJson(""));
        assertThrows(InterchangeException.class, () -> codec.fromJson("   "));
        assertThrows(InterchangeException.class, () -> codec.fromJson(null));
    }

    @Test
    void decode_malformedJsonRejected() {
        InterchangeException e = assertThrows(InterchangeException.class, () -> codec.fromJson("{\"type\":"));

        assertNotNull(e.getCause());
        assertTrue(e.getDetailedMessage().contains("JSON: {\"type\":"));
    }

    @Test
    void decode_unknownDiscriminantRejected() {
        assertThrows(InterchangeException.class, () -> codec.fromJson("{\"type\":\"loop\"}"));
    }

    @Test
    void decode_missingRequiredChildRejected() {
        assertThrows(InterchangeException.class,
                () -> codec.fromJson("{\"type\":\"group\",\"redirects\":[]}"));
    }

    @Test
    void decode_invalidRedirectTargetRejected() {
        String json = "{\"type\":\"simple\",\"words\":[],"
                + "\"redirects\":[{\"direction\":\"output\",\"target\":{\"socket\":1}}]}";

        assertThrows(InterchangeException.class, () -> codec.fromJson(json));
    }

    @Test
    void decode_nullLiteralRejected() {
        assertThrows(InterchangeException.class, () -> codec.fromJson("null"));
    }
}
