package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Lenient reading of JSON produced by the generator.
 */
final class StructuredOutput {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StructuredOutput() {
    }

    /**
     * Parse a JSON object. Anything else yields {@link #isEmpty(JsonNode) an
     * empty} object.
     */
    static JsonNode parseObject(String content) {
        if (content == null || content.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(content);
            return node != null && node.isObject() ? node : MAPPER.createObjectNode();
        } catch (JsonProcessingException ex) {
            return MAPPER.createObjectNode();
        }
    }

    static boolean isEmpty(JsonNode node) {
        return node.isObject() && node.isEmpty();
    }

    /**
     * Textual elements of an array field; other element types are dropped.
     */
    static List<String> strings(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.path(field);
        if (array.isArray()) {
            array.forEach(element -> {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            });
        }
        return values;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    static String preview(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + "\n...[truncated]";
    }
}
