package com.linlay.agentstream.stream;

import com.linlay.agentstream.config.MarkerProperties;
import com.linlay.agentstream.config.StreamSessionProperties;
import com.linlay.agentstream.stream.assemble.ResponseAssembler;
import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.dispatch.EventDispatcher;
import com.linlay.agentstream.stream.handler.DebugHandler;
import com.linlay.agentstream.stream.handler.LifecycleHandler;
import com.linlay.agentstream.stream.handler.LoggingHandler;
import com.linlay.agentstream.stream.handler.MessageHandler;
import com.linlay.agentstream.stream.handler.ReasoningHandler;
import com.linlay.agentstream.stream.handler.ToolHandler;
import com.linlay.agentstream.stream.session.AgentComputation;
import com.linlay.agentstream.stream.session.SessionState;
import com.linlay.agentstream.stream.session.StreamSession;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 为每次运行组装独立的会话状态、事件分发器和响应组装器。
 */
@Component
public class StreamSessionFactory {

    private final AgentComputation computation;
    private final StreamSessionProperties sessionProperties;
    private final MarkerProperties markerProperties;
    private final ToolValueNormalizer normalizer;
    private final DebugHandler debugHandler;

    public StreamSessionFactory(
            AgentComputation computation,
            StreamSessionProperties sessionProperties,
            MarkerProperties markerProperties,
            ToolValueNormalizer normalizer,
            DebugHandler debugHandler
    ) {
        this.computation = computation;
        this.sessionProperties = sessionProperties;
        this.markerProperties = markerProperties;
        this.normalizer = normalizer;
        this.debugHandler = debugHandler;
    }

    public StreamPipeline create() {
        SessionState state = new SessionState();
        StreamSession session = new StreamSession(computation, state, sessionProperties);
        ResponseAssembler assembler = new ResponseAssembler(
                state,
                sessionProperties.getEmptyResponseText(),
                markerProperties.getOpenTag(),
                markerProperties.getCloseTag()
        );
        return new StreamPipeline(UUID.randomUUID().toString(), session, newDispatcher(state), assembler);
    }

    public EventDispatcher newDispatcher(SessionState state) {
        EventDispatcher dispatcher = new EventDispatcher();
        dispatcher.register(new MessageHandler(state, markerProperties.newSplitter(), normalizer));
        dispatcher.register(new ToolHandler(state, normalizer));
        dispatcher.register(new ReasoningHandler(state));
        dispatcher.register(new LifecycleHandler());
        dispatcher.register(new LoggingHandler());
        dispatcher.register(debugHandler);
        return dispatcher;
    }

    public DebugHandler debugHandler() {
        return debugHandler;
    }
}
