package com.linlay.agentstream.stream.assemble;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a tool input or result is structured JSON or plain display text.
 */
public class ToolValueNormalizer {

    private static final TypeReference<Object> ANY_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolValueNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Normalized normalize(Object value) {
        if (value == null) {
            return new Normalized(null, false);
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return new Normalized(value, true);
        }
        if (value instanceof JsonNode node) {
            if (node.isTextual()) {
                return normalize(node.asText());
            }
            return new Normalized(objectMapper.convertValue(node, ANY_TYPE), node.isContainerNode());
        }
        if (value instanceof String text) {
            String candidate = text.strip();
            if (candidate.startsWith("{") || candidate.startsWith("[")) {
                try {
                    return new Normalized(objectMapper.readValue(candidate, ANY_TYPE), true);
                } catch (JsonProcessingException ignored) {
                    // partial or invalid JSON stays plain text
                }
            }
            return new Normalized(text, false);
        }
        return new Normalized(value, false);
    }

    public record Normalized(Object value, boolean structured) {
    }
}
