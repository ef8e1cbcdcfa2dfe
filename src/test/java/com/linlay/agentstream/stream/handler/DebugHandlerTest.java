package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebugHandlerTest {

    @Test
    void disabledHandlerShouldAcceptNothing() {
        DebugHandler handler = new DebugHandler(false, 10);

        assertThat(handler.canHandle(EventKind.DATA)).isFalse();
        handler.handle(AgentEvent.data("x"));
        assertThat(handler.entries()).isEmpty();
    }

    @Test
    void retentionShouldBeBoundedToMostRecentEvents() {
        DebugHandler handler = new DebugHandler(true, 3);

        for (int i = 0; i < 5; i++) {
            handler.handle(AgentEvent.data("chunk-" + i));
        }

        assertThat(handler.entries()).hasSize(3);
        assertThat(handler.entries()).extracting(entry -> entry.eventData().get("data"))
                .containsExactly("chunk-2", "chunk-3", "chunk-4");
        assertThat(handler.entries()).allSatisfy(entry -> assertThat(entry.eventType()).isEqualTo("data"));
    }

    @Test
    void togglingShouldTakeEffectImmediately() {
        DebugHandler handler = new DebugHandler(false, 5);

        handler.setEnabled(true);
        assertThat(handler.canHandle(EventKind.UNKNOWN)).isTrue();
        handler.handle(AgentEvent.forceStop("Timeout"));
        handler.setEnabled(false);
        handler.handle(AgentEvent.data("ignored"));

        assertThat(handler.entries()).hasSize(1);
        handler.clear();
        assertThat(handler.entries()).isEmpty();
    }

    @Test
    void nonPositiveCapacityShouldBeRejected() {
        assertThatThrownBy(() -> new DebugHandler(true, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
