package com.linlay.agentstream.stream.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured output of one handler invocation.
 */
public record HandlerOutcome(
        String type,
        Map<String, Object> data
) {

    public static final String HANDLER_ERROR = "handler_error";

    public HandlerOutcome {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (data == null) {
            data = Map.of();
        } else {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static HandlerOutcome of(String type, Map<String, Object> data) {
        return new HandlerOutcome(type, data);
    }

    public static HandlerOutcome handlerError(String handler, Throwable error, EventKind kind) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("handler", handler);
        data.put("errorType", error.getClass().getSimpleName());
        data.put("errorMessage", error.getMessage() == null ? "" : error.getMessage());
        data.put("eventKind", kind == null ? EventKind.UNKNOWN.key() : kind.key());
        return new HandlerOutcome(HANDLER_ERROR, data);
    }

    public boolean isError() {
        return HANDLER_ERROR.equals(type);
    }
}
