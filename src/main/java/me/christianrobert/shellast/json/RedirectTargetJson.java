package me.christianrobert.shellast.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import me.christianrobert.shellast.ast.element.RedirectTarget;

import java.io.IOException;

/**
 * Jackson support for {@link RedirectTarget}: a single-key object, either
 * {@code {"file": "out.txt"}} or {@code {"fd": 2}}.
 */
final class RedirectTargetJson {

    static final String FILE = "file";
    static final String FD = "fd";

    private RedirectTargetJson() {
    }

    static SimpleModule module() {
        SimpleModule module = new SimpleModule("RedirectTargetModule");
        module.addSerializer(RedirectTarget.class, new Serializer());
        module.addDeserializer(RedirectTarget.class, new Deserializer());
        return module;
    }

    static class Serializer extends StdSerializer<RedirectTarget> {

        Serializer() {
            super(RedirectTarget.class);
        }

        @Override
        public void serialize(RedirectTarget target, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            if (target instanceof RedirectTarget.Fd) {
                gen.writeNumberField(FD, ((RedirectTarget.Fd) target).getFd());
            } else {
                gen.writeStringField(FILE, ((RedirectTarget.File) target).getName());
            }
            gen.writeEndObject();
        }
    }

    static class Deserializer extends StdDeserializer<RedirectTarget> {

        Deserializer() {
            super(RedirectTarget.class);
        }

        @Override
        public RedirectTarget deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            if (node != null && node.isObject()) {
                JsonNode file = node.get(FILE);
                if (file != null && file.isTextual()) {
                    return RedirectTarget.file(file.asText());
                }
                JsonNode fd = node.get(FD);
                if (fd != null && fd.isInt()) {
                    return RedirectTarget.fd(fd.intValue());
                }
            }
            return ctxt.reportInputMismatch(RedirectTarget.class,
                    "Redirect target must be {\"file\": <string>} or {\"fd\": <int>}");
        }
    }
}
