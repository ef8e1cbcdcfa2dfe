package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.model.ToolInvocation;
import com.linlay.agentstream.stream.model.ToolStatus;
import com.linlay.agentstream.stream.session.SessionState;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks tool invocations across {@code current_tool_use} and {@code tool_result} events.
 */
public class ToolHandler implements EventHandler {

    public static final int PRIORITY = 20;
    public static final String OUTCOME_TOOL = "tool";

    private static final Set<EventKind> KINDS = EnumSet.of(EventKind.TOOL_USE, EventKind.TOOL_RESULT, EventKind.FORCE_STOP);

    private final SessionState state;
    private final ToolValueNormalizer normalizer;

    public ToolHandler(SessionState state, ToolValueNormalizer normalizer) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return KINDS.contains(kind);
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        ToolInvocation touched = null;
        if (event.has(AgentEvent.CURRENT_TOOL_USE)) {
            touched = handleToolUse(event.map(AgentEvent.CURRENT_TOOL_USE).orElseGet(Map::of));
        }
        if (event.has(AgentEvent.TOOL_RESULT)) {
            touched = handleToolResult(event.get(AgentEvent.TOOL_RESULT));
        }
        if (event.isForceStop()) {
            if (state.toolInvocations().isEmpty()) {
                return Optional.empty();
            }
            state.markUnfinishedTools(ToolStatus.ERROR);
            return Optional.of(HandlerOutcome.of(OUTCOME_TOOL, Map.of("status", ToolStatus.ERROR.name())));
        }
        return Optional.ofNullable(touched).map(this::toOutcome);
    }

    private ToolInvocation handleToolUse(Map<?, ?> toolData) {
        String toolUseId = toolUseId(toolData);
        String name = toolData.get("name") == null ? null : String.valueOf(toolData.get("name"));
        ToolInvocation entry;
        if (toolUseId == null) {
            entry = state.latestTool()
                    .filter(latest -> latest.toolUseId() == null && !latest.isFinished())
                    .filter(latest -> name == null || name.equals(latest.name()))
                    .orElseGet(() -> state.toolOrCreate(null, name));
        } else {
            entry = state.toolOrCreate(toolUseId, name);
        }

        ToolValueNormalizer.Normalized input = normalizer.normalize(toolData.get("input"));
        if (isPresent(input.value())) {
            entry.updateInput(input.value(), input.structured());
            entry.status(ToolStatus.RUNNING);
        }
        return entry;
    }

    private ToolInvocation handleToolResult(Object payload) {
        String toolUseId = null;
        Object display = payload;
        ToolStatus status = ToolStatus.COMPLETE;
        if (payload instanceof Map<?, ?> map) {
            toolUseId = toolUseId(map);
            if ("error".equals(map.get("status"))) {
                status = ToolStatus.ERROR;
            }
            if (map.containsKey("output")) {
                display = map.get("output");
            } else if (map.containsKey("content")) {
                display = map.get("content");
            } else {
                Map<Object, Object> stripped = new LinkedHashMap<>(map);
                stripped.remove("toolUseId");
                stripped.remove("tool_use_id");
                if (!stripped.isEmpty()) {
                    display = stripped;
                }
            }
        }

        ToolInvocation entry;
        if (toolUseId != null) {
            entry = state.toolOrCreate(toolUseId, null);
        } else {
            entry = state.latestTool().orElseGet(() -> state.toolOrCreate(null, "Tool"));
        }
        ToolValueNormalizer.Normalized result = normalizer.normalize(display);
        entry.updateResult(result.value(), result.structured());
        entry.status(status);
        return entry;
    }

    private HandlerOutcome toOutcome(ToolInvocation entry) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", entry.name());
        data.put("toolUseId", entry.toolUseId());
        data.put("status", entry.status().name());
        return HandlerOutcome.of(OUTCOME_TOOL, data);
    }

    private static String toolUseId(Map<?, ?> data) {
        Object id = data.get("toolUseId");
        if (id == null) {
            id = data.get("tool_use_id");
        }
        if (id == null || String.valueOf(id).isBlank()) {
            return null;
        }
        return String.valueOf(id);
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
