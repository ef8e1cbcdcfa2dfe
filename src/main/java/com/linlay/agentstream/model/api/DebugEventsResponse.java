package com.linlay.agentstream.model.api;

import com.linlay.agentstream.stream.handler.DebugHandler;

import java.util.List;

public record DebugEventsResponse(
        boolean enabled,
        List<DebugHandler.DebugEntry> events
) {
}
