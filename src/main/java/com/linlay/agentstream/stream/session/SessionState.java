package com.linlay.agentstream.stream.session;

import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.model.AssistantMessage;
import com.linlay.agentstream.stream.model.ToolInvocation;
import com.linlay.agentstream.stream.model.ToolStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run accumulation of streamed text, tool invocations and terminal signals.
 * <p>
 * Mutated only from the consuming side of a {@link StreamSession} through dispatch
 * handlers, one event at a time, so it carries no locking. Reset when a run starts and
 * frozen once the final message has been assembled.
 */
public class SessionState {

    private static final Logger log = LoggerFactory.getLogger(SessionState.class);

    private final StringBuilder rawText = new StringBuilder();
    private final StringBuilder filteredText = new StringBuilder();
    private final StringBuilder reasoningText = new StringBuilder();
    private final List<ToolInvocation> toolInvocations = new ArrayList<>();
    private final Map<String, ToolInvocation> toolsById = new LinkedHashMap<>();

    private String hiddenText;
    private AgentResult finalResult;
    private String forceStopError;
    private boolean frozen;

    public void reset() {
        rawText.setLength(0);
        filteredText.setLength(0);
        reasoningText.setLength(0);
        toolInvocations.clear();
        toolsById.clear();
        hiddenText = null;
        finalResult = null;
        forceStopError = null;
        frozen = false;
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void appendRaw(String chunk) {
        ensureMutable();
        rawText.append(chunk);
    }

    public void appendFiltered(String visible) {
        ensureMutable();
        filteredText.append(visible);
    }

    public void appendReasoning(String chunk) {
        ensureMutable();
        reasoningText.append(chunk);
    }

    public void hiddenText(String hiddenText) {
        ensureMutable();
        this.hiddenText = hiddenText;
    }

    public void finalResult(AgentResult finalResult) {
        ensureMutable();
        this.finalResult = finalResult;
    }

    public void forceStop(String error) {
        ensureMutable();
        this.forceStopError = error;
    }

    public String rawText() {
        return rawText.toString();
    }

    public String filteredText() {
        return filteredText.toString();
    }

    public String reasoningText() {
        return reasoningText.toString();
    }

    public Optional<String> hiddenText() {
        return Optional.ofNullable(hiddenText);
    }

    public Optional<AgentResult> finalResult() {
        return Optional.ofNullable(finalResult);
    }

    public Optional<String> forceStopError() {
        return Optional.ofNullable(forceStopError);
    }

    public List<ToolInvocation> toolInvocations() {
        return List.copyOf(toolInvocations);
    }

    public Optional<ToolInvocation> tool(String toolUseId) {
        if (toolUseId == null || toolUseId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(toolsById.get(toolUseId));
    }

    public Optional<ToolInvocation> latestTool() {
        return toolInvocations.isEmpty()
                ? Optional.empty()
                : Optional.of(toolInvocations.get(toolInvocations.size() - 1));
    }

    /**
     * Finds the entry for {@code toolUseId}, or creates one named {@code name}
     * (falling back to "Tool N").
     */
    public ToolInvocation toolOrCreate(String toolUseId, String name) {
        ensureMutable();
        Optional<ToolInvocation> existing = tool(toolUseId);
        if (existing.isPresent()) {
            existing.get().rename(name);
            return existing.get();
        }
        String resolvedName = name == null || name.isBlank() ? "Tool " + (toolInvocations.size() + 1) : name;
        String id = toolUseId == null || toolUseId.isBlank() ? null : toolUseId;
        ToolInvocation created = new ToolInvocation(id, resolvedName);
        toolInvocations.add(created);
        if (id != null) {
            toolsById.put(id, created);
        }
        return created;
    }

    /**
     * Name-only lookup used when a tool signal carries no id. Matches only when exactly
     * one entry with that name is still missing its input; ambiguous names match nothing.
     */
    public Optional<ToolInvocation> uniqueToolAwaitingInput(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        List<ToolInvocation> candidates = toolInvocations.stream()
                .filter(tool -> name.equals(tool.name()) && !tool.hasInput())
                .toList();
        if (candidates.size() > 1) {
            log.debug("ambiguous tool name without id name={}, candidates={}", name, candidates.size());
        }
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    public boolean hasToolNamed(String name) {
        return name != null && toolInvocations.stream().anyMatch(tool -> name.equals(tool.name()));
    }

    public void markUnfinishedTools(ToolStatus to) {
        ensureMutable();
        toolInvocations.stream()
                .filter(tool -> !tool.isFinished())
                .forEach(tool -> tool.status(to));
    }

    public List<AssistantMessage.ToolCall> toolSnapshots() {
        return toolInvocations.stream().map(ToolInvocation::snapshot).toList();
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Session state is frozen; start a new session before mutating it");
        }
    }
}
