package me.christianrobert.shellast.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.shellast.ast.Command;
import me.christianrobert.shellast.ast.util.CommandTreeFormatter;
import me.christianrobert.shellast.config.ConfigService;
import me.christianrobert.shellast.foreign.ParseResult;
import me.christianrobert.shellast.foreign.ShellParser;
import me.christianrobert.shellast.json.CommandJsonCodec;
import me.christianrobert.shellast.normalizer.ShellTreeNormalizer;
import me.christianrobert.shellast.unparser.ShellUnparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * High-level service for turning shell scripts into command trees and back.
 * This is the main entry point for tooling that needs structured access to scripts.
 *
 * <p>Architecture:
 * <pre>
 * script → ShellParser → foreign tree → ShellTreeNormalizer → Command → ShellUnparser → script
 *                                                                ↕
 *                                                        CommandJsonCodec
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * ParseOutcome outcome = service.parse(script);
 * if (outcome.isSuccess()) {
 *     String regenerated = service.serialize(outcome.getCommand());
 * } else {
 *     // outcome.getFailureKind(), outcome.getErrorMessage()
 * }
 * </pre>
 *
 * <p>The shell parser keeps global state: it is initialized once, and every parse together
 * with the normalization of its tree runs under one lock. Foreign resources are released
 * before the lock is given up.
 */
@ApplicationScoped
public class ShellAstService {

    private static final Logger log = LoggerFactory.getLogger(ShellAstService.class);

    @Inject
    Instance<ShellParser> parserInstance;

    @Inject
    ConfigService configService;

    @Inject
    CommandJsonCodec jsonCodec;

    private final ReentrantLock parserLock = new ReentrantLock();

    // guarded by parserLock; set once initialize() has succeeded
    private ShellParser parser;

    // ========== PARSING ==========

    /**
     * Parses a script into a canonical command tree.
     *
     * @param script Shell script text
     * @return ParseOutcome containing either the tree or failure details
     */
    public ParseOutcome parse(String script) {
        return parse(script, false, false);
    }

    /**
     * Same as {@link #parse(String)} but asks the parser for diagnostics, which end up in the
     * error message of a syntax failure.
     */
    public ParseOutcome parseVerbose(String script) {
        return parse(script, true, false);
    }

    /**
     * Parses a script into a canonical command tree.
     *
     * @param script Shell script text
     * @param verbose Whether the parser should collect diagnostics
     * @param includeTree Whether to include a formatted tree in the outcome (for debugging)
     * @return ParseOutcome containing either the tree or failure details
     */
    public ParseOutcome parse(String script, boolean verbose, boolean includeTree) {
        ParseOutcome rejected = validate(script);
        if (rejected != null) {
            log.warn("Rejected script: {}", rejected.getErrorMessage());
            return rejected;
        }

        log.debug("Parsing script ({} chars, verbose={})", script.length(), verbose);
        log.trace("Script: {}", script);

        parserLock.lock();
        try {
            // STEP 1: Make sure the parser is available and initialized
            ShellParser shellParser = acquireParser();
            if (shellParser == null) {
                return ParseOutcome.failure(script, ParseFailureKind.PARSER_FAILURE,
                        "No shell parser implementation is available");
            }

            // STEP 2: Parse; the result is closed before the lock is released
            try (ParseResult result = shellParser.parse(script, verbose)) {
                if (result == null) {
                    log.error("Shell parser returned no result");
                    return ParseOutcome.failure(script, ParseFailureKind.PARSER_FAILURE,
                            "Shell parser returned no result");
                }
                if (result.getTree() == null) {
                    String errorMsg = result.hasErrors()
                            ? "Syntax error: " + result.getErrorMessage()
                            : "Syntax error";
                    log.warn("Parse failed: {}", errorMsg);
                    return ParseOutcome.failure(script, ParseFailureKind.SYNTAX_ERROR, errorMsg);
                }

                // STEP 3: Normalize the foreign tree
                log.debug("Normalizing foreign tree");
                Optional<Command> command = createNormalizer().normalize(result.getTree());
                if (command.isEmpty()) {
                    return ParseOutcome.failure(script, ParseFailureKind.CONVERSION_ERROR,
                            "Parsed script could not be converted into a command tree");
                }

                log.info("Successfully parsed script into {}", command.get().getClass().getSimpleName());
                if (includeTree) {
                    return ParseOutcome.successWithTree(script, command.get(),
                            CommandTreeFormatter.format(command.get()));
                }
                return ParseOutcome.success(script, command.get());
            }

        } catch (RuntimeException e) {
            log.error("Unexpected error inside shell parser", e);
            return ParseOutcome.failure(script, ParseFailureKind.PARSER_FAILURE,
                    "Unexpected parser failure: " + e.getMessage());

        } finally {
            parserLock.unlock();
        }
    }

    /**
     * Checks the input before it reaches the parser: size first, then emptiness, then content.
     *
     * @return a failure outcome, or null if the script may be parsed
     */
    ParseOutcome validate(String script) {
        int maxSize = configService.getPositiveInteger(ConfigService.MAX_SCRIPT_SIZE, 10 * 1024 * 1024);
        if (script != null && utf8Length(script, maxSize) > maxSize) {
            return ParseOutcome.failure(script, ParseFailureKind.INPUT_TOO_LARGE,
                    "Script exceeds the maximum size of " + maxSize + " bytes");
        }
        if (script == null || script.isBlank()) {
            return ParseOutcome.failure(script, ParseFailureKind.EMPTY_INPUT, "Script cannot be null or empty");
        }
        if (script.indexOf('\0') >= 0) {
            return ParseOutcome.failure(script, ParseFailureKind.INVALID_STRING,
                    "Script contains a NUL character");
        }
        return null;
    }

    // Every char encodes to at least one byte, so a long enough string is too large without encoding it
    private static long utf8Length(String script, int maxSize) {
        if (script.length() > maxSize) {
            return script.length();
        }
        return script.getBytes(StandardCharsets.UTF_8).length;
    }

    private ShellParser acquireParser() {
        if (parser != null) {
            return parser;
        }
        if (parserInstance == null || parserInstance.isUnsatisfied()) {
            log.error("No ShellParser implementation found");
            return null;
        }
        ShellParser candidate = parserInstance.get();
        log.info("Initializing shell parser {}", candidate.getClass().getSimpleName());
        candidate.initialize();
        parser = candidate;
        return parser;
    }

    private ShellTreeNormalizer createNormalizer() {
        return new ShellTreeNormalizer(
                configService.getPositiveInteger(ConfigService.MAX_DEPTH, ShellTreeNormalizer.DEFAULT_MAX_DEPTH),
                configService.getPositiveInteger(ConfigService.MAX_LIST_LENGTH, ShellTreeNormalizer.DEFAULT_MAX_LIST_LENGTH));
    }

    // ========== SERIALIZATION ==========

    /**
     * Writes a command tree as shell source text.
     */
    public String serialize(Command command) {
        return ShellUnparser.serialize(command);
    }

    /**
     * Encodes a command tree in the JSON interchange format.
     */
    public String toJson(Command command, boolean pretty) {
        return jsonCodec.toJson(command, pretty);
    }

    /**
     * Decodes a command tree from the JSON interchange format.
     *
     * @throws me.christianrobert.shellast.json.InterchangeException if the JSON is invalid
     */
    public Command fromJson(String json) {
        return jsonCodec.fromJson(json);
    }

    /**
     * Decodes a command tree from JSON and writes it as shell source text.
     *
     * @throws me.christianrobert.shellast.json.InterchangeException if the JSON is invalid
     */
    public String jsonToShell(String json) {
        Command command = fromJson(json);
        log.debug("Converting {} from JSON to shell text", command.getClass().getSimpleName());
        return serialize(command);
    }
}
