package com.linlay.agentstream.stream.dispatch;

import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Routes each {@link AgentEvent} to every registered handler that accepts its kind,
 * in ascending priority order. A failing handler is reported as a
 * {@link HandlerOutcome#HANDLER_ERROR} outcome and never stops the others.
 */
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private static final List<EventKind> CLASSIFY_ORDER = List.of(
            EventKind.DATA,
            EventKind.TOOL_USE,
            EventKind.TOOL_RESULT,
            EventKind.REASONING_TEXT,
            EventKind.RESULT,
            EventKind.FORCE_STOP
    );

    private static final Comparator<Registration> ORDER = Comparator.comparingInt(Registration::priority);

    private final List<Registration> registrations = new ArrayList<>();

    public void register(EventHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        register(handler, handler.priority());
    }

    public void register(EventHandler handler, int priority) {
        Objects.requireNonNull(handler, "handler must not be null");
        registrations.add(new Registration(handler, priority));
        // List.sort is stable, so equal priorities keep registration order
        registrations.sort(ORDER);
    }

    public List<EventHandler> handlers() {
        return registrations.stream().map(Registration::handler).toList();
    }

    public <T extends EventHandler> Optional<T> find(Class<T> type) {
        return registrations.stream()
                .map(Registration::handler)
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    public EventKind classify(AgentEvent event) {
        if (event == null || event.isEmpty()) {
            return EventKind.UNKNOWN;
        }
        for (EventKind kind : CLASSIFY_ORDER) {
            if (event.has(kind.key())) {
                return kind;
            }
        }
        String firstKey = event.payload().keySet().iterator().next();
        return EventKind.fromKey(firstKey);
    }

    public List<HandlerOutcome> dispatch(AgentEvent event) {
        EventKind kind = classify(event);
        return invokeAll(kind, handler -> handler.canHandle(kind) ? handler.handle(event) : Optional.empty());
    }

    /**
     * Signals end of stream to every handler.
     */
    public List<HandlerOutcome> complete() {
        return invokeAll(EventKind.COMPLETE, EventHandler::complete);
    }

    public void reset() {
        for (Registration registration : registrations) {
            try {
                registration.handler().reset();
            } catch (RuntimeException ex) {
                log.warn("handler reset failed handler={}", registration.handler().name(), ex);
            }
        }
    }

    private List<HandlerOutcome> invokeAll(
            EventKind kind,
            Function<EventHandler, Optional<HandlerOutcome>> invocation
    ) {
        List<HandlerOutcome> outcomes = new ArrayList<>();
        for (Registration registration : List.copyOf(registrations)) {
            EventHandler handler = registration.handler();
            try {
                Optional<HandlerOutcome> outcome = invocation.apply(handler);
                if (outcome != null) {
                    outcome.ifPresent(outcomes::add);
                }
            } catch (RuntimeException ex) {
                log.warn("event handler failed handler={}, kind={}", handler.name(), kind.key(), ex);
                outcomes.add(HandlerOutcome.handlerError(handler.name(), ex, kind));
            }
        }
        return outcomes;
    }

    private record Registration(EventHandler handler, int priority) {
    }
}
