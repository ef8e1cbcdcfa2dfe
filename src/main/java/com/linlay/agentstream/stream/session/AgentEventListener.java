package com.linlay.agentstream.stream.session;

import java.util.Map;

/**
 * Callback the computation invokes synchronously for every piece of output.
 */
@FunctionalInterface
public interface AgentEventListener {

    void onEvent(Map<String, Object> payload);
}
