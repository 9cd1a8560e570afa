package me.christianrobert.shellast.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.shellast.ast.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes command trees in the JSON interchange format.
 *
 * <p>The format is driven by the Jackson annotations on the model: every node carries a
 * {@code type} discriminant ({@code simple}, {@code if}, {@code function_def}, ...),
 * conditional expressions carry {@code cond_type}, and field names are snake_case.
 * Only annotated fields are mapped; getters and helper methods are ignored.
 *
 * <p>Example:
 * <pre>
 * {"type":"simple","line":1,"words":[{"word":"echo"},{"word":"hi"}],"redirects":[]}
 * </pre>
 */
@ApplicationScoped
public class CommandJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(CommandJsonCodec.class);

    private final ObjectMapper objectMapper;

    public CommandJsonCodec() {
        this.objectMapper = new ObjectMapper()
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .registerModule(RedirectTargetJson.module());
    }

    /**
     * Encodes a command tree as compact JSON.
     */
    public String toJson(Command command) {
        return toJson(command, false);
    }

    /**
     * Encodes a command tree as JSON.
     *
     * @param command Tree to encode
     * @param pretty Whether to indent the output
     * @return JSON text
     * @throws InterchangeException if encoding fails
     */
    public String toJson(Command command, boolean pretty) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        try {
            if (pretty) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(command);
            }
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new InterchangeException("Failed to encode command tree as JSON", e);
        }
    }

    /**
     * Decodes a command tree from JSON.
     *
     * @param json JSON text
     * @return Decoded tree
     * @throws InterchangeException if the text is not valid JSON or does not describe a command tree
     */
    public Command fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new InterchangeException("JSON input is empty", json, null);
        }
        try {
            Command command = objectMapper.readValue(json, Command.class);
            if (command == null) {
                throw new InterchangeException("JSON input does not contain a command", json, null);
            }
            log.debug("Decoded {} from JSON ({} chars)", command.getClass().getSimpleName(), json.length());
            return command;
        } catch (JsonProcessingException e) {
            throw new InterchangeException("Failed to decode command tree from JSON", json, e);
        }
    }
}
