package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.session.SessionState;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningHandlerTest {

    private final SessionState state = new SessionState();
    private final ReasoningHandler handler = new ReasoningHandler(state);

    @Test
    void reasoningTextShouldAccumulate() {
        handler.handle(AgentEvent.of(Map.of("reasoningText", "First, ")));
        Optional<HandlerOutcome> outcome = handler.handle(AgentEvent.of(Map.of("reasoningText", "then.")));

        assertThat(state.reasoningText()).isEqualTo("First, then.");
        assertThat(outcome).get().extracting(HandlerOutcome::data)
                .isEqualTo(Map.of("kind", "reasoningText", "delta", "then."));
    }

    @Test
    void signatureOnlyEventShouldReportKindWithoutText() {
        Optional<HandlerOutcome> outcome = handler.handle(AgentEvent.of(Map.of("reasoning_signature", "abc")));

        assertThat(state.reasoningText()).isEmpty();
        assertThat(outcome).get().extracting(HandlerOutcome::data)
                .isEqualTo(Map.of("kind", "reasoning_signature"));
    }

    @Test
    void onlyReasoningKindsShouldBeAccepted() {
        assertThat(handler.canHandle(EventKind.REDACTED_CONTENT)).isTrue();
        assertThat(handler.canHandle(EventKind.DATA)).isFalse();
        assertThat(new LifecycleHandler().canHandle(EventKind.START_EVENT_LOOP)).isTrue();
        assertThat(new LifecycleHandler().canHandle(EventKind.REASONING)).isFalse();
    }

    @Test
    void lifecycleHandlerShouldReportPhase() {
        Optional<HandlerOutcome> outcome = new LifecycleHandler().handle(AgentEvent.of(Map.of("init_event_loop", true)));

        assertThat(outcome).get().extracting(HandlerOutcome::data).isEqualTo(Map.of("phase", "init_event_loop"));
    }
}
