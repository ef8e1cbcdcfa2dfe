package com.linlay.agentstream.stream.model;

import java.util.List;

/**
 * Live view of a running session for renderers that cannot wait for the final message.
 */
public record StreamProgress(
        String filteredText,
        List<AssistantMessage.ToolCall> toolCalls,
        int handlerErrors
) {

    public StreamProgress {
        filteredText = filteredText == null ? "" : filteredText;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
