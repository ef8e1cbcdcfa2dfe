package com.linlay.agentstream.stream.assemble;

import com.linlay.agentstream.stream.marker.MarkerSplitter;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.model.AssistantMessage;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.model.StreamProgress;
import com.linlay.agentstream.stream.model.ToolStatus;
import com.linlay.agentstream.stream.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds the outcomes of one run into the final {@link AssistantMessage}.
 * <p>
 * A forced stop wins over everything else: the message then carries only the error text.
 * Otherwise the visible text is the marker-filtered stream, or, when nothing was streamed,
 * the text of the computation's own result message.
 */
public class ResponseAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResponseAssembler.class);

    private final SessionState state;
    private final String emptyResponseText;
    private final String openTag;
    private final String closeTag;

    private final Map<String, Integer> outcomeCounts = new LinkedHashMap<>();
    private final List<HandlerOutcome> handlerErrors = new ArrayList<>();
    private AssistantMessage finalMessage;

    public ResponseAssembler(SessionState state, String emptyResponseText, String openTag, String closeTag) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.emptyResponseText = emptyResponseText == null ? "" : emptyResponseText;
        this.openTag = Objects.requireNonNull(openTag, "openTag must not be null");
        this.closeTag = Objects.requireNonNull(closeTag, "closeTag must not be null");
    }

    public void accept(List<HandlerOutcome> outcomes) {
        if (outcomes == null) {
            return;
        }
        for (HandlerOutcome outcome : outcomes) {
            outcomeCounts.merge(outcome.type(), 1, Integer::sum);
            if (outcome.isError()) {
                handlerErrors.add(outcome);
            }
        }
    }

    public StreamProgress progress() {
        return new StreamProgress(state.filteredText(), state.toolSnapshots(), handlerErrors.size());
    }

    public List<HandlerOutcome> handlerErrors() {
        return List.copyOf(handlerErrors);
    }

    public int outcomeCount(String type) {
        return outcomeCounts.getOrDefault(type, 0);
    }

    /**
     * Builds the final message once and freezes the session state. Later calls return the
     * same message.
     */
    public AssistantMessage finalizeResponse() {
        if (finalMessage != null) {
            return finalMessage;
        }
        Optional<String> forceStopError = state.forceStopError();
        if (forceStopError.isPresent()) {
            state.markUnfinishedTools(ToolStatus.ERROR);
            state.freeze();
            finalMessage = AssistantMessage.error(forceStopError.get(), state.toolSnapshots());
            return finalMessage;
        }

        String text = state.filteredText().trim();
        String chainOfThought = state.hiddenText().orElse(null);
        if (text.isEmpty()) {
            Optional<MarkerSplitter.Split> fromResult = state.finalResult()
                    .map(AgentResult::message)
                    .map(ResponseAssembler::messageText)
                    .map(raw -> MarkerSplitter.split(raw, openTag, closeTag));
            if (fromResult.isPresent()) {
                text = fromResult.get().visible().trim();
                if (chainOfThought == null) {
                    chainOfThought = fromResult.get().hidden();
                }
            }
        }
        if (text.isEmpty()) {
            log.debug("no visible text produced, using placeholder");
            text = emptyResponseText;
        }
        if (chainOfThought == null && !state.reasoningText().isBlank()) {
            chainOfThought = state.reasoningText();
        }

        state.markUnfinishedTools(ToolStatus.COMPLETE);
        state.freeze();
        finalMessage = new AssistantMessage(text, chainOfThought, state.toolSnapshots(), false);
        return finalMessage;
    }

    /**
     * Extracts display text from a result message: a plain string, a map with a string
     * {@code content}, or a map whose {@code content} list holds {@code {text}} blocks.
     */
    static String messageText(Object message) {
        if (message instanceof String text) {
            return text;
        }
        if (!(message instanceof Map<?, ?> map)) {
            return null;
        }
        Object content = map.get("content");
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof Collection<?> blocks) {
            for (Object block : blocks) {
                if (block instanceof Map<?, ?> blockMap && blockMap.get("text") instanceof String text) {
                    return text;
                }
            }
        }
        return null;
    }
}
