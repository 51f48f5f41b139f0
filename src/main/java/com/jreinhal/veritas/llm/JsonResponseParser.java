package com.jreinhal.veritas.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Pulls the JSON object out of a structured model reply. Models often wrap JSON in code fences or
 * prepend a sentence, so everything outside the outermost braces is ignored.
 */
@Component
public class JsonResponseParser {
    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedModelOutputException("Empty model response");
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedModelOutputException("No JSON object in model response");
        }
        try {
            JsonNode node = this.objectMapper.readTree(raw.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new MalformedModelOutputException("Model response is not a JSON object");
            }
            return node;
        }
        catch (JsonProcessingException e) {
            throw new MalformedModelOutputException("Unparseable JSON in model response", e);
        }
    }

    public static List<String> textList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.path(field);
        if (array.isArray()) {
            for (JsonNode element : array) {
                String text = element.asText("").trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
        }
        return values;
    }
}
