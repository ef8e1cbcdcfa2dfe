package com.linlay.agentstream.stream.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Outbound frame pushed to stream subscribers, one per pipeline update.
 */
public record StreamEvent(
        long seq,
        String type,
        String runId,
        long timestamp,
        Map<String, Object> payload
) {

    public static final String CONTENT_DELTA = "content.delta";
    public static final String TOOL_UPDATE = "tool.update";
    public static final String REASONING = "reasoning";
    public static final String LIFECYCLE = "lifecycle";
    public static final String HANDLER_ERROR = "handler.error";
    public static final String RUN_ERROR = "run.error";
    public static final String MESSAGE_FINAL = "message.final";

    private static final Set<String> RESERVED_KEYS = Set.of("seq", "type", "runId", "timestamp");

    public StreamEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (seq < 0) {
            throw new IllegalArgumentException("seq must not be negative");
        }
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be null or blank");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public boolean isFinal() {
        return MESSAGE_FINAL.equals(type);
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", seq);
        data.put("type", type);
        data.put("runId", runId);
        data.put("timestamp", timestamp);
        payload.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                data.put(key, value);
            }
        });
        return data;
    }
}
