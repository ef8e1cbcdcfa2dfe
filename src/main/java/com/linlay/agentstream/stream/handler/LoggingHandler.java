package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Logs every event at debug level; produces no outcome.
 */
public class LoggingHandler implements EventHandler {

    public static final int PRIORITY = 80;

    private static final Logger log = LoggerFactory.getLogger(LoggingHandler.class);

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return true;
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        if (!log.isDebugEnabled()) {
            return Optional.empty();
        }
        log.debug("agent event received keys={}", event.payload().keySet());
        if (event.isFinalResult()) {
            AgentResult result = AgentResult.from(event.get(AgentEvent.RESULT));
            log.debug(
                    "agent result message={}, toolMetrics={}, usage={}",
                    result.message(),
                    result.toolMetrics().size(),
                    result.usage()
            );
        }
        return Optional.empty();
    }
}
