package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the most recent events for inspection while debugging is enabled.
 * The retained list may be read from other threads.
 */
public class DebugHandler implements EventHandler {

    public static final int PRIORITY = 95;

    private final int maxEvents;
    private final Deque<DebugEntry> entries = new ArrayDeque<>();
    private volatile boolean enabled;

    public DebugHandler(boolean enabled, int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive");
        }
        this.enabled = enabled;
        this.maxEvents = maxEvents;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return enabled;
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        if (!enabled) {
            return Optional.empty();
        }
        String firstKey = event.payload().keySet().stream().findFirst().orElse(EventKind.UNKNOWN.key());
        synchronized (entries) {
            entries.addLast(new DebugEntry(firstKey, event.payload()));
            while (entries.size() > maxEvents) {
                entries.removeFirst();
            }
        }
        return Optional.empty();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<DebugEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public record DebugEntry(String eventType, Map<String, Object> eventData) {
    }
}
