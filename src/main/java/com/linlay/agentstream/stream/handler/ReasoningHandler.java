package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.session.SessionState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects reasoning text the model streams as dedicated events, as opposed to reasoning
 * embedded between markers in regular text.
 */
public class ReasoningHandler implements EventHandler {

    public static final int PRIORITY = 30;
    public static final String OUTCOME_REASONING = "reasoning";

    private static final List<EventKind> REASONING_KEYS = List.of(
            EventKind.REASONING_TEXT,
            EventKind.REASONING,
            EventKind.REASONING_SIGNATURE,
            EventKind.REDACTED_CONTENT
    );

    private final SessionState state;

    public ReasoningHandler(SessionState state) {
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return kind.isReasoning();
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        EventKind kind = REASONING_KEYS.stream()
                .filter(candidate -> event.has(candidate.key()))
                .findFirst()
                .orElse(EventKind.REASONING);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", kind.key());
        event.string(AgentEvent.REASONING_TEXT)
                .filter(text -> !text.isEmpty())
                .ifPresent(text -> {
                    state.appendReasoning(text);
                    data.put("delta", text);
                });
        return Optional.of(HandlerOutcome.of(OUTCOME_REASONING, data));
    }
}
