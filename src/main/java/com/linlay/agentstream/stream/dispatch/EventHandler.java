package com.linlay.agentstream.stream.dispatch;

import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;

import java.util.Optional;

/**
 * Unit of event processing registered with an {@link EventDispatcher}.
 */
public interface EventHandler {

    int DEFAULT_PRIORITY = 100;

    boolean canHandle(EventKind kind);

    Optional<HandlerOutcome> handle(AgentEvent event);

    /**
     * Lower values run earlier.
     */
    default int priority() {
        return DEFAULT_PRIORITY;
    }

    /**
     * Identity reported in logs and {@code handler_error} outcomes. Anonymous and lambda
     * classes fall back to their binary name.
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isBlank() ? getClass().getName() : simpleName;
    }

    /**
     * Called once after the last event of a stream has been dispatched.
     */
    default Optional<HandlerOutcome> complete() {
        return Optional.empty();
    }

    /**
     * Called before a new stream starts.
     */
    default void reset() {
    }
}
