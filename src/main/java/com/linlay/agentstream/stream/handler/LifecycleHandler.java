package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;

import java.util.Map;
import java.util.Optional;

public class LifecycleHandler implements EventHandler {

    public static final int PRIORITY = 50;
    public static final String OUTCOME_LIFECYCLE = "lifecycle";

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return kind.isLifecycle();
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        String phase = event.payload().keySet().stream().findFirst().orElse(EventKind.UNKNOWN.key());
        return Optional.of(HandlerOutcome.of(OUTCOME_LIFECYCLE, Map.of("phase", phase)));
    }
}
