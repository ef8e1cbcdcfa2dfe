package com.linlay.agentstream.stream.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable key/value payload emitted by the agent computation callback.
 * Key order is preserved as produced.
 */
public record AgentEvent(Map<String, Object> payload) {

    public static final String DATA = "data";
    public static final String CURRENT_TOOL_USE = "current_tool_use";
    public static final String TOOL_RESULT = "tool_result";
    public static final String REASONING_TEXT = "reasoningText";
    public static final String RESULT = "result";
    public static final String FORCE_STOP = "force_stop";
    public static final String FORCE_STOP_REASON = "force_stop_reason";

    public AgentEvent {
        if (payload == null || payload.isEmpty()) {
            payload = Map.of();
        } else {
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }

    public static AgentEvent of(Map<String, Object> payload) {
        return new AgentEvent(payload);
    }

    public static AgentEvent data(String chunk) {
        return new AgentEvent(Map.of(DATA, chunk == null ? "" : chunk));
    }

    public static AgentEvent result(AgentResult result) {
        return new AgentEvent(Map.of(RESULT, result == null ? AgentResult.empty() : result));
    }

    public static AgentEvent forceStop(String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FORCE_STOP, Boolean.TRUE);
        payload.put(FORCE_STOP_REASON, reason == null || reason.isBlank() ? "Unknown error" : reason);
        return new AgentEvent(payload);
    }

    public boolean has(String key) {
        return payload.containsKey(key);
    }

    public Object get(String key) {
        return payload.get(key);
    }

    public Optional<String> string(String key) {
        Object value = payload.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    public Optional<Map<?, ?>> map(String key) {
        Object value = payload.get(key);
        return value instanceof Map<?, ?> nested ? Optional.of(nested) : Optional.empty();
    }

    public boolean isForceStop() {
        return Boolean.TRUE.equals(payload.get(FORCE_STOP));
    }

    public boolean isFinalResult() {
        return payload.get(RESULT) != null;
    }

    public boolean isTerminal() {
        return isFinalResult() || isForceStop();
    }

    public String forceStopReason() {
        Object reason = payload.get(FORCE_STOP_REASON);
        return reason == null ? "Unknown error" : String.valueOf(reason);
    }

    public boolean isEmpty() {
        return payload.isEmpty();
    }
}
