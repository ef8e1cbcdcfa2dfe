package com.linlay.agentstream.stream;

import com.linlay.agentstream.stream.assemble.ResponseAssembler;
import com.linlay.agentstream.stream.dispatch.EventDispatcher;
import com.linlay.agentstream.stream.handler.LifecycleHandler;
import com.linlay.agentstream.stream.handler.MessageHandler;
import com.linlay.agentstream.stream.handler.ReasoningHandler;
import com.linlay.agentstream.stream.handler.ToolHandler;
import com.linlay.agentstream.stream.model.AssistantMessage;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.model.StreamEvent;
import com.linlay.agentstream.stream.model.StreamProgress;
import com.linlay.agentstream.stream.session.StreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One run: session events go through the dispatcher, every outcome is folded into the
 * assembler and mirrored as a {@link StreamEvent}; the stream always ends with
 * {@code message.final}.
 */
public class StreamPipeline {

    private static final Logger log = LoggerFactory.getLogger(StreamPipeline.class);

    private final String runId;
    private final StreamSession session;
    private final EventDispatcher dispatcher;
    private final ResponseAssembler assembler;
    private final AtomicLong seq = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean();

    public StreamPipeline(String runId, StreamSession session, EventDispatcher dispatcher, ResponseAssembler assembler) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        this.runId = runId;
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
    }

    public Flux<StreamEvent> run(String input) {
        return Flux.defer(() -> {
            if (!started.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Pipeline already ran: " + runId));
            }
            log.debug("stream run started runId={}", runId);
            dispatcher.reset();
            session.start(input);

            Flux<StreamEvent> body = session.events()
                    .concatMap(event -> Flux.fromIterable(publish(dispatcher.dispatch(event))));

            Flux<StreamEvent> completeFlux = Flux.defer(() -> {
                List<StreamEvent> tail = new ArrayList<>(publish(dispatcher.complete()));
                AssistantMessage message = assembler.finalizeResponse();
                tail.add(next(StreamEvent.MESSAGE_FINAL, Map.of("message", message)));
                log.debug("stream run finished runId={}, forceStop={}", runId, message.forceStop());
                return Flux.fromIterable(tail);
            });

            return body.concatWith(completeFlux)
                    .onErrorResume(ex -> {
                        log.error("stream run failed runId={}", runId, ex);
                        String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                        return Flux.just(next(StreamEvent.RUN_ERROR, Map.of("error", error)));
                    });
        });
    }

    /**
     * Runs to the end and emits only the final message.
     */
    public Mono<AssistantMessage> complete(String input) {
        return run(input).then(Mono.fromSupplier(assembler::finalizeResponse));
    }

    public StreamProgress progress() {
        return assembler.progress();
    }

    public String runId() {
        return runId;
    }

    public StreamSession session() {
        return session;
    }

    private List<StreamEvent> publish(List<HandlerOutcome> outcomes) {
        assembler.accept(outcomes);
        List<StreamEvent> events = new ArrayList<>(outcomes.size());
        for (HandlerOutcome outcome : outcomes) {
            String type = streamType(outcome.type());
            if (type != null) {
                events.add(next(type, outcome.data()));
            }
        }
        return events;
    }

    private static String streamType(String outcomeType) {
        return switch (outcomeType) {
            case MessageHandler.OUTCOME_CONTENT -> StreamEvent.CONTENT_DELTA;
            case MessageHandler.OUTCOME_FORCE_STOP -> StreamEvent.RUN_ERROR;
            case ToolHandler.OUTCOME_TOOL -> StreamEvent.TOOL_UPDATE;
            case ReasoningHandler.OUTCOME_REASONING -> StreamEvent.REASONING;
            case LifecycleHandler.OUTCOME_LIFECYCLE -> StreamEvent.LIFECYCLE;
            case HandlerOutcome.HANDLER_ERROR -> StreamEvent.HANDLER_ERROR;
            default -> null;
        };
    }

    private StreamEvent next(String type, Map<String, Object> payload) {
        return new StreamEvent(seq.incrementAndGet(), type, runId, System.currentTimeMillis(), payload);
    }
}
