package com.linlay.agentstream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.stream.StreamPipeline;
import com.linlay.agentstream.stream.StreamSessionFactory;
import com.linlay.agentstream.stream.handler.DebugHandler;
import com.linlay.agentstream.stream.model.AssistantMessage;
import com.linlay.agentstream.stream.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
public class AgentStreamService {

    private static final Logger log = LoggerFactory.getLogger(AgentStreamService.class);
    private static final String SSE_EVENT_MESSAGE = "message";

    private final StreamSessionFactory sessionFactory;
    private final ObjectMapper objectMapper;

    public AgentStreamService(StreamSessionFactory sessionFactory, ObjectMapper objectMapper) {
        this.sessionFactory = sessionFactory;
        this.objectMapper = objectMapper;
    }

    public Flux<StreamEvent> stream(String message) {
        return Flux.defer(() -> sessionFactory.create().run(requireMessage(message)));
    }

    public Flux<ServerSentEvent<String>> streamSse(String message) {
        return stream(message).map(this::toSse);
    }

    public Mono<AssistantMessage> complete(String message) {
        return Mono.defer(() -> {
            StreamPipeline pipeline = sessionFactory.create();
            return pipeline.complete(requireMessage(message));
        });
    }

    public boolean debugEnabled() {
        return sessionFactory.debugHandler().isEnabled();
    }

    public List<DebugHandler.DebugEntry> debugEvents() {
        return sessionFactory.debugHandler().entries();
    }

    private String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        return message.trim();
    }

    private ServerSentEvent<String> toSse(StreamEvent event) {
        return ServerSentEvent.<String>builder()
                .event(SSE_EVENT_MESSAGE)
                .data(toJson(event))
                .build();
    }

    private String toJson(StreamEvent event) {
        try {
            return objectMapper.writeValueAsString(event.toData());
        } catch (JsonProcessingException ex) {
            log.error("failed to serialize stream event type={}, runId={}", event.type(), event.runId(), ex);
            return "{\"type\":\"" + StreamEvent.RUN_ERROR + "\",\"error\":\"serialization failure\"}";
        }
    }
}
