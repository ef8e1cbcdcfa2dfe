package com.linlay.agentstream.stream.session;

import com.linlay.agentstream.stream.model.AgentResult;

/**
 * Opaque, blocking and non-interruptible agent call. Implementations report partial
 * output through the listener while running and return the final result, or throw.
 */
@FunctionalInterface
public interface AgentComputation {

    AgentResult invoke(String input, AgentEventListener listener) throws Exception;
}
