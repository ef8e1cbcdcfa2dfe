package com.linlay.agentstream.stream.handler;

import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.dispatch.EventHandler;
import com.linlay.agentstream.stream.marker.MarkerSplitter;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.model.EventKind;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.model.ToolInvocation;
import com.linlay.agentstream.stream.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Streams text chunks through the {@link MarkerSplitter}, stores the final result and
 * records forced stops.
 */
public class MessageHandler implements EventHandler {

    public static final int PRIORITY = 10;
    public static final String OUTCOME_CONTENT = "content";
    public static final String OUTCOME_RESULT = "result";
    public static final String OUTCOME_FORCE_STOP = "force_stop";

    private static final Logger log = LoggerFactory.getLogger(MessageHandler.class);
    private static final Set<EventKind> KINDS = EnumSet.of(EventKind.DATA, EventKind.RESULT, EventKind.FORCE_STOP);

    private final SessionState state;
    private final MarkerSplitter splitter;
    private final ToolValueNormalizer normalizer;

    public MessageHandler(SessionState state, MarkerSplitter splitter, ToolValueNormalizer normalizer) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.splitter = Objects.requireNonNull(splitter, "splitter must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(EventKind kind) {
        return KINDS.contains(kind);
    }

    @Override
    public Optional<HandlerOutcome> handle(AgentEvent event) {
        Optional<HandlerOutcome> outcome = Optional.empty();
        if (event.has(AgentEvent.DATA)) {
            outcome = handleData(event.get(AgentEvent.DATA));
        }
        if (event.isFinalResult()) {
            outcome = Optional.of(handleResult(AgentResult.from(event.get(AgentEvent.RESULT))));
        }
        if (event.isForceStop()) {
            outcome = Optional.of(handleForceStop(event.forceStopReason()));
        }
        return outcome;
    }

    @Override
    public Optional<HandlerOutcome> complete() {
        return visibleOutcome(splitter.finish());
    }

    @Override
    public void reset() {
        splitter.reset();
    }

    private Optional<HandlerOutcome> handleData(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String chunk = value instanceof String text ? text : String.valueOf(value);
        if (chunk.isEmpty()) {
            return Optional.empty();
        }
        state.appendRaw(chunk);
        return visibleOutcome(splitter.feed(chunk));
    }

    private Optional<HandlerOutcome> visibleOutcome(String visible) {
        splitter.hiddenText()
                .filter(hidden -> !hidden.equals(state.hiddenText().orElse(null)))
                .ifPresent(state::hiddenText);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        state.appendFiltered(visible);
        return Optional.of(HandlerOutcome.of(OUTCOME_CONTENT, Map.of("delta", visible)));
    }

    private HandlerOutcome handleResult(AgentResult result) {
        state.finalResult(result);
        int backfilled = 0;
        for (AgentResult.ToolMetric metric : result.toolMetrics()) {
            if (backfillInput(metric)) {
                backfilled++;
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("backfilledInputs", backfilled);
        data.put("hasMessage", result.message() != null);
        return HandlerOutcome.of(OUTCOME_RESULT, data);
    }

    private HandlerOutcome handleForceStop(String reason) {
        String error = "Error: " + reason;
        state.forceStop(error);
        log.info("stream force stopped reason={}", reason);
        return HandlerOutcome.of(OUTCOME_FORCE_STOP, Map.of("reason", reason, "error", error));
    }

    /**
     * Fills a tool input from post-run metrics, but only where the streamed input is still
     * empty. Without an id a name-only match is accepted when it is unambiguous.
     */
    private boolean backfillInput(AgentResult.ToolMetric metric) {
        Object rawInput = metric.input();
        if (rawInput == null || (rawInput instanceof String text && text.isEmpty())) {
            return false;
        }
        ToolInvocation target;
        if (metric.toolUseId() != null && !metric.toolUseId().isBlank()) {
            target = state.toolOrCreate(metric.toolUseId(), metric.name());
        } else if (metric.name() == null || metric.name().isBlank()) {
            return false;
        } else if (!state.hasToolNamed(metric.name())) {
            target = state.toolOrCreate(null, metric.name());
        } else {
            Optional<ToolInvocation> unique = state.uniqueToolAwaitingInput(metric.name());
            if (unique.isEmpty()) {
                log.debug("skip tool input backfill without id name={}", metric.name());
                return false;
            }
            target = unique.get();
        }
        if (target.hasInput()) {
            return false;
        }
        ToolValueNormalizer.Normalized normalized = normalizer.normalize(rawInput);
        target.updateInput(normalized.value(), normalized.structured());
        return true;
    }
}
