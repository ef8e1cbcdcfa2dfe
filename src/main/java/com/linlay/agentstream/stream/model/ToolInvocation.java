package com.linlay.agentstream.stream.model;

import java.util.Collection;
import java.util.Map;

/**
 * Accumulated record of one tool call, mutated in place as tool events arrive.
 */
public final class ToolInvocation {

    private final String toolUseId;
    private String name;
    private Object input;
    private boolean inputStructured;
    private Object result;
    private boolean resultStructured;
    private ToolStatus status = ToolStatus.PENDING;

    public ToolInvocation(String toolUseId, String name) {
        this.toolUseId = toolUseId;
        this.name = name;
    }

    public String toolUseId() {
        return toolUseId;
    }

    public String name() {
        return name;
    }

    public Object input() {
        return input;
    }

    public boolean inputStructured() {
        return inputStructured;
    }

    public Object result() {
        return result;
    }

    public boolean resultStructured() {
        return resultStructured;
    }

    public ToolStatus status() {
        return status;
    }

    public void rename(String name) {
        if (name != null && !name.isBlank()) {
            this.name = name;
        }
    }

    public void updateInput(Object input, boolean structured) {
        this.input = input;
        this.inputStructured = structured;
    }

    public void updateResult(Object result, boolean structured) {
        this.result = result;
        this.resultStructured = structured;
    }

    public void status(ToolStatus status) {
        this.status = status;
    }

    /**
     * Null, blank strings and empty maps or lists count as "not yet known".
     */
    public boolean hasInput() {
        if (input == null) {
            return false;
        }
        if (input instanceof String text) {
            return !text.isBlank();
        }
        if (input instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (input instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    public boolean isFinished() {
        return status == ToolStatus.COMPLETE || status == ToolStatus.ERROR;
    }

    public AssistantMessage.ToolCall snapshot() {
        return new AssistantMessage.ToolCall(name, toolUseId, input, inputStructured, result, resultStructured, status);
    }
}
