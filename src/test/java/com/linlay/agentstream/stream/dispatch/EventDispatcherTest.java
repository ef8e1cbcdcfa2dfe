package com.linlay.agentstream.stream.dispatch;

import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventDispatcherTest {

    private final EventDispatcher dispatcher = new EventDispatcher();

    @Test
    void classifyShouldFollowKeyPriority() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("result", "done");
        payload.put("current_tool_use", Map.of("name", "calculator"));
        payload.put("data", "chunk");

        assertThat(dispatcher.classify(AgentEvent.of(payload))).isEqualTo(EventKind.DATA);
        assertThat(dispatcher.classify(AgentEvent.of(Map.of("result", "x", "force_stop", true))))
                .isEqualTo(EventKind.RESULT);
        assertThat(dispatcher.classify(AgentEvent.of(Map.of("reasoningText", "hmm"))))
                .isEqualTo(EventKind.REASONING_TEXT);
        assertThat(dispatcher.classify(AgentEvent.forceStop("broken"))).isEqualTo(EventKind.FORCE_STOP);
    }

    @Test
    void classifyShouldFallBackToFirstKeyThenUnknown() {
        assertThat(dispatcher.classify(AgentEvent.of(Map.of("init_event_loop", true))))
                .isEqualTo(EventKind.INIT_EVENT_LOOP);
        assertThat(dispatcher.classify(AgentEvent.of(Map.of("something_else", 1))))
                .isEqualTo(EventKind.UNKNOWN);
        assertThat(dispatcher.classify(AgentEvent.of(Map.of()))).isEqualTo(EventKind.UNKNOWN);
        assertThat(dispatcher.classify(null)).isEqualTo(EventKind.UNKNOWN);
    }

    @Test
    void classifyShouldBeDeterministic() {
        AgentEvent event = AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t1"), "start", true));

        EventKind first = dispatcher.classify(event);
        for (int i = 0; i < 10; i++) {
            assertThat(dispatcher.classify(event)).isEqualTo(first);
        }
        assertThat(first).isEqualTo(EventKind.TOOL_RESULT);
    }

    @Test
    void handlersShouldRunInPriorityOrderWithStableTies() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(new RecordingHandler("late", 90, calls));
        dispatcher.register(new RecordingHandler("first", 10, calls));
        dispatcher.register(new RecordingHandler("tieA", 50, calls));
        dispatcher.register(new RecordingHandler("tieB", 50, calls));

        dispatcher.dispatch(AgentEvent.data("x"));

        assertThat(calls).containsExactly("first", "tieA", "tieB", "late");
        assertThat(dispatcher.handlers()).extracting(EventHandler::name)
                .containsExactly("first", "tieA", "tieB", "late");
    }

    @Test
    void explicitPriorityShouldOverrideHandlerPriority() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(new RecordingHandler("a", 10, calls), 70);
        dispatcher.register(new RecordingHandler("b", 60, calls));

        dispatcher.dispatch(AgentEvent.data("x"));

        assertThat(calls).containsExactly("b", "a");
    }

    @Test
    void failingHandlerShouldNotStopLaterHandlers() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(new EventHandler() {
            @Override
            public boolean canHandle(EventKind kind) {
                return true;
            }

            @Override
            public Optional<HandlerOutcome> handle(AgentEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public int priority() {
                return 1;
            }

            @Override
            public String name() {
                return "exploding";
            }
        });
        dispatcher.register(new RecordingHandler("after", 5, calls));

        List<HandlerOutcome> outcomes = dispatcher.dispatch(AgentEvent.data("chunk"));

        assertThat(calls).containsExactly("after");
        assertThat(outcomes).hasSize(2);
        HandlerOutcome error = outcomes.get(0);
        assertThat(error.isError()).isTrue();
        assertThat(error.type()).isEqualTo(HandlerOutcome.HANDLER_ERROR);
        assertThat(error.data())
                .containsEntry("handler", "exploding")
                .containsEntry("errorType", "IllegalStateException")
                .containsEntry("errorMessage", "boom")
                .containsEntry("eventKind", "data");
        assertThat(outcomes.get(1).type()).isEqualTo("after");
    }

    @Test
    void anonymousFailingHandlerShouldStillBeIdentified() {
        dispatcher.register(new EventHandler() {
            @Override
            public boolean canHandle(EventKind kind) {
                return true;
            }

            @Override
            public Optional<HandlerOutcome> handle(AgentEvent event) {
                throw new IllegalStateException("boom");
            }
        });

        List<HandlerOutcome> outcomes = dispatcher.dispatch(AgentEvent.data("chunk"));

        assertThat(outcomes).hasSize(1);
        assertThat(outcomes.get(0).data().get("handler"))
                .asString()
                .isNotBlank()
                .startsWith(EventDispatcherTest.class.getName());
    }

    @Test
    void handlersRejectingKindShouldBeSkipped() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(new RecordingHandler("dataOnly", 10, calls) {
            @Override
            public boolean canHandle(EventKind kind) {
                return kind == EventKind.DATA;
            }
        });

        List<HandlerOutcome> outcomes = dispatcher.dispatch(AgentEvent.of(Map.of("mystery", 1)));

        assertThat(calls).isEmpty();
        assertThat(outcomes).isEmpty();
    }

    @Test
    void completeAndResetShouldReachEveryHandlerDespiteFailures() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(new RecordingHandler("broken", 10, calls) {
            @Override
            public Optional<HandlerOutcome> complete() {
                throw new IllegalArgumentException("cannot complete");
            }

            @Override
            public void reset() {
                throw new IllegalArgumentException("cannot reset");
            }
        });
        dispatcher.register(new RecordingHandler("healthy", 20, calls));

        List<HandlerOutcome> outcomes = dispatcher.complete();
        dispatcher.reset();

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).data()).containsEntry("eventKind", "complete");
        assertThat(outcomes.get(1).type()).isEqualTo("healthy.complete");
        assertThat(calls).containsExactly("healthy.complete", "healthy.reset");
    }

    @Test
    void findShouldReturnRegisteredHandlerByType() {
        RecordingHandler handler = new RecordingHandler("only", 10, new ArrayList<>());
        dispatcher.register(handler);

        assertThat(dispatcher.find(RecordingHandler.class)).contains(handler);
    }

    private static class RecordingHandler implements EventHandler {

        private final String name;
        private final int priority;
        private final List<String> calls;

        RecordingHandler(String name, int priority, List<String> calls) {
            this.name = name;
            this.priority = priority;
            this.calls = calls;
        }

        @Override
        public boolean canHandle(EventKind kind) {
            return true;
        }

        @Override
        public Optional<HandlerOutcome> handle(AgentEvent event) {
            calls.add(name);
            return Optional.of(HandlerOutcome.of(name, Map.of()));
        }

        @Override
        public Optional<HandlerOutcome> complete() {
            calls.add(name + ".complete");
            return Optional.of(HandlerOutcome.of(name + ".complete", Map.of()));
        }

        @Override
        public void reset() {
            calls.add(name + ".reset");
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public String name() {
            return name;
        }
    }
}
