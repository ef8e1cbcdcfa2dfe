package com.linlay.agentstream.stream.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final structured message of one streamed run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssistantMessage(
        String text,
        String chainOfThought,
        List<ToolCall> toolCalls,
        boolean forceStop
) {

    public AssistantMessage {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AssistantMessage error(String errorText, List<ToolCall> toolCalls) {
        return new AssistantMessage(errorText, null, toolCalls, true);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolCall(
            String name,
            String toolUseId,
            Object input,
            boolean inputStructured,
            Object result,
            boolean resultStructured,
            ToolStatus status
    ) {
    }
}
