package org.relaysync.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code last_log} either as a list of lines or as the single newline-joined string
 * older store files hold. Blank lines of the joined form are dropped.
 */
public class LogLinesDeserializer extends StdDeserializer<List<String>> {

    public LogLinesDeserializer() {
        super(List.class);
    }

    @Override
    public List<String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        List<String> lines = new ArrayList<>();
        if (node.isTextual()) {
            for (String line : node.asText().split("\\R")) {
                if (!line.isBlank()) lines.add(line);
            }
        } else if (node.isArray()) {
            for (JsonNode line : node) {
                lines.add(line.asText());
            }
        } else {
            return ctxt.reportInputMismatch(this, "last_log must be a string or a list of strings, got %s",
                    node.getNodeType());
        }
        return lines;
    }
}
