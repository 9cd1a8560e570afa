package me.christianrobert.shellast.service;

import jakarta.enterprise.inject.Instance;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.command.ListCommand;
import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.element.ListOp;
import me.christianrobert.shellast.ast.element.Word;
import me.christianrobert.shellast.config.ConfigService;
import me.christianrobert.shellast.foreign.ForeignNode;
import me.christianrobert.shellast.foreign.ParseResult;
import me.christianrobert.shellast.foreign.ShellParser;
import me.christianrobert.shellast.json.CommandJsonCodec;
import me.christianrobert.shellast.json.InterchangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static me.christianrobert.shellast.foreign.ForeignTrees.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ShellAstService.
 * The shell parser is mocked; the normalizer, unparser and codec are real.
 */
class ShellAstServiceTest {

    private ShellAstService service;
    private ShellParser parser;
    private Instance<ShellParser> parserInstance;
    private AtomicInteger disposed;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        parser = mock(ShellParser.class);
        parserInstance = mock(Instance.class);
        when(parserInstance.isUnsatisfied()).thenReturn(false);
        when(parserInstance.get()).thenReturn(parser);

        service = new ShellAstService();
        service.parserInstance = parserInstance;
        service.configService = new ConfigService();
        service.jsonCodec = new CommandJsonCodec();

        disposed = new AtomicInteger();
    }

    private ParseResult result(ForeignNode tree, String... errors) {
        return new ParseResult(tree, List.of(errors), disposed::incrementAndGet);
    }

    // ========== INPUT VALIDATION ==========

    @Test
    void emptyInput_rejectedBeforeParsing() {
        assertEquals(ParseFailureKind.EMPTY_INPUT, service.parse(null).getFailureKind());
        assertEquals(ParseFailureKind.EMPTY_INPUT, service.parse("").getFailureKind());
        assertEquals(ParseFailureKind.EMPTY_INPUT, service.parse(" \n\t ").getFailureKind());

        verifyNoInteractions(parser);
    }

    @Test
    void oversizedInput_rejectedBeforeParsing() {
        service.configService.setConfigValue(ConfigService.MAX_SCRIPT_SIZE, 10);

        ParseOutcome outcome = service.parse("echo 123456789");

        assertTrue(outcome.isFailure());
        assertEquals(ParseFailureKind.INPUT_TOO_LARGE, outcome.getFailureKind());
        verifyNoInteractions(parser);
    }

    @Test
    void size_isMeasuredInUtf8Bytes() {
        service.configService.setConfigValue(ConfigService.MAX_SCRIPT_SIZE, 9);

        // five characters, ten bytes
        assertEquals(ParseFailureKind.INPUT_TOO_LARGE, service.parse("ééééé").getFailureKind());
    }

    @Test
    void size_isCheckedBeforeEmptiness() {
        service.configService.setConfigValue(ConfigService.MAX_SCRIPT_SIZE, 4);

        assertEquals(ParseFailureKind.INPUT_TOO_LARGE, service.parse("          ").getFailureKind());
    }

    @Test
    void nulCharacter_rejectedBeforeParsing() {
        ParseOutcome outcome = service.parse("echo a\0b");

        assertEquals(ParseFailureKind.INVALID_STRING, outcome.getFailureKind());
        verifyNoInteractions(parser);
    }

    // ========== PARSING ==========

    @Test
    void parse_success() {
        when(parser.parse("echo hi", false)).thenReturn(result(simple("echo", "hi").line(1)));

        ParseOutcome outcome = service.parse("echo hi");

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals(new SimpleCommand(1, List.of(new Word("echo"), new Word("hi")), List.of(), List.of()),
                outcome.getCommand());
        assertNull(outcome.getFailureKind());
        assertFalse(outcome.hasCommandTree());
        assertEquals(1, disposed.get(), "Parse result must be released");
    }

    @Test
    void parse_withTree() {
        when(parser.parse("echo hi", false)).thenReturn(result(simple("echo", "hi")));

        ParseOutcome outcome = service.parse("echo hi", false, true);

        assertTrue(outcome.hasCommandTree());
        assertEquals("simple [echo hi]\n", outcome.getCommandTree());
    }

    @Test
    void parseVerbose_asksForDiagnostics() {
        when(parser.parse("fi", true)).thenReturn(result(null, "syntax error near unexpected token `fi'"));

        ParseOutcome outcome = service.parseVerbose("fi");

        verify(parser).parse("fi", true);
        assertEquals(ParseFailureKind.SYNTAX_ERROR, outcome.getFailureKind());
        assertTrue(outcome.getErrorMessage().contains("unexpected token"));
    }

    @Test
    void parseVerbose_diagnosticsWithTreeStillSucceed() {
        when(parser.parse("echo hi", true)).thenReturn(result(simple("echo", "hi"), "warning: here-document at line 1"));

        ParseOutcome outcome = service.parseVerbose("echo hi");

        assertTrue(outcome.isSuccess());
        assertEquals(1, disposed.get(), "Parse result should be closed");
    }

    @Test
    void syntaxError_withoutDiagnostics() {
        when(parser.parse("if", false)).thenReturn(result(null));

        ParseOutcome outcome = service.parse("if");

        assertEquals(ParseFailureKind.SYNTAX_ERROR, outcome.getFailureKind());
        assertEquals("Syntax error", outcome.getErrorMessage());
        assertEquals(1, disposed.get());
    }

    @Test
    void conversionError_isDistinctFromSyntaxError() {
        when(parser.parse("weird", false)).thenReturn(result(new Node(99)));

        ParseOutcome outcome = service.parse("weird");

        assertEquals(ParseFailureKind.CONVERSION_ERROR, outcome.getFailureKind());
        assertNull(outcome.getCommand());
        assertEquals(1, disposed.get());
    }

    @Test
    void configuredDepthLimit_isApplied() {
        ForeignNode deep = simple("x");
        for (int i = 0; i < 5; i++) {
            deep = group(deep);
        }
        when(parser.parse(anyString(), anyBoolean())).thenReturn(result(deep));
        service.configService.setConfigValue(ConfigService.MAX_DEPTH, 3);

        assertEquals(ParseFailureKind.CONVERSION_ERROR, service.parse("{ { { { { x; }; }; }; }; }").getFailureKind());
    }

    @Test
    void parserException_isParserFailure() {
        when(parser.parse(anyString(), anyBoolean())).thenThrow(new IllegalStateException("parser state corrupted"));

        ParseOutcome outcome = service.parse("echo");

        assertEquals(ParseFailureKind.PARSER_FAILURE, outcome.getFailureKind());
        assertTrue(outcome.getErrorMessage().contains("parser state corrupted"));
    }

    @Test
    void parserReturningNothing_isParserFailure() {
        when(parser.parse(anyString(), anyBoolean())).thenReturn(null);

        assertEquals(ParseFailureKind.PARSER_FAILURE, service.parse("echo").getFailureKind());
    }

    @Test
    void missingParserImplementation_isParserFailure() {
        when(parserInstance.isUnsatisfied()).thenReturn(true);

        assertEquals(ParseFailureKind.PARSER_FAILURE, service.parse("echo").getFailureKind());
        verify(parserInstance, never()).get();
    }

    @Test
    void parser_isInitializedOnce() {
        when(parser.parse(anyString(), anyBoolean())).thenReturn(result(simple("true")));

        service.parse("true");
        service.parse("true");
        service.parse("true");

        verify(parser, times(1)).initialize();
        verify(parser, times(3)).parse("true", false);
    }

    @Test
    void failedInitialization_isRetried() {
        org.mockito.Mockito.doThrow(new IllegalStateException("not ready")).doNothing().when(parser).initialize();
        when(parser.parse(anyString(), anyBoolean())).thenReturn(result(simple("true")));

        assertEquals(ParseFailureKind.PARSER_FAILURE, service.parse("true").getFailureKind());
        assertTrue(service.parse("true").isSuccess());
        verify(parser, times(2)).initialize();
    }

    @Test
    void parserAccess_isSerialized() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(parser.parse(anyString(), anyBoolean())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(1);
            inFlight.decrementAndGet();
            return result(simple("true"));
        });

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<ParseOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(executor.submit(() -> service.parse("true")));
            }
            for (Future<ParseOutcome> future : futures) {
                assertTrue(future.get(30, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInFlight.get(), "Parser must never be entered concurrently");
        assertEquals(40, disposed.get());
        verify(parser, times(1)).initialize();
    }

    // ========== SERIALIZATION ==========

    @Test
    void serialize_usesUnparser() {
        Command tree = new ListCommand(ListOp.AND,
                new SimpleCommand(List.of(new Word("make"))),
                new SimpleCommand(List.of(new Word("echo"), new Word("ok"))));

        assertEquals("make && echo ok", service.serialize(tree));
        assertEquals("", service.serialize(null));
    }

    @Test
    void json_roundTripThroughService() {
        Command tree = new SimpleCommand(List.of(new Word("ls"), new Word("-la")));

        String json = service.toJson(tree, false);

        assertEquals(tree, service.fromJson(json));
        assertEquals("ls -la", service.jsonToShell(json));
    }

    @Test
    void jsonToShell_invalidJson() {
        assertThrows(InterchangeException.class, () -> service.jsonToShell("{not json"));
    }
}
