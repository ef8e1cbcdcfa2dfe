package com.linlay.agentstream.stream.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routing label derived from an {@link AgentEvent}. Never persisted.
 */
public enum EventKind {

    DATA("data"),
    DELTA("delta"),
    TOOL_USE("current_tool_use"),
    TOOL_RESULT("tool_result"),

    INIT_EVENT_LOOP("init_event_loop"),
    START_EVENT_LOOP("start_event_loop"),
    START("start"),
    MESSAGE("message"),
    EVENT("event"),
    COMPLETE("complete"),

    REASONING("reasoning"),
    REASONING_TEXT("reasoningText"),
    REASONING_SIGNATURE("reasoning_signature"),
    REDACTED_CONTENT("redactedContent"),

    RESULT("result"),
    FORCE_STOP("force_stop"),
    UNKNOWN("unknown");

    private static final Map<String, EventKind> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventKind::key, Function.identity()));

    private final String key;

    EventKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isLifecycle() {
        return switch (this) {
            case INIT_EVENT_LOOP, START_EVENT_LOOP, START, MESSAGE, EVENT, COMPLETE -> true;
            default -> false;
        };
    }

    public boolean isReasoning() {
        return switch (this) {
            case REASONING, REASONING_TEXT, REASONING_SIGNATURE, REDACTED_CONTENT -> true;
            default -> false;
        };
    }

    public static EventKind fromKey(String key) {
        if (key == null) {
            return UNKNOWN;
        }
        return BY_KEY.getOrDefault(key, UNKNOWN);
    }
}
