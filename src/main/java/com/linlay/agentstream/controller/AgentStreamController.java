package com.linlay.agentstream.controller;

import com.linlay.agentstream.model.api.ApiResponse;
import com.linlay.agentstream.model.api.DebugEventsResponse;
import com.linlay.agentstream.model.api.QueryRequest;
import com.linlay.agentstream.service.AgentStreamService;
import com.linlay.agentstream.service.SseFlushWriter;
import com.linlay.agentstream.stream.model.AssistantMessage;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/stream")
public class AgentStreamController {

    private final AgentStreamService agentStreamService;
    private final SseFlushWriter sseFlushWriter;

    public AgentStreamController(AgentStreamService agentStreamService, SseFlushWriter sseFlushWriter) {
        this.agentStreamService = agentStreamService;
        this.sseFlushWriter = sseFlushWriter;
    }

    @PostMapping(value = "/query", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> query(@Valid @RequestBody QueryRequest request, ServerHttpResponse response) {
        return sseFlushWriter.write(response, agentStreamService.streamSse(request.message()));
    }

    @PostMapping("/complete")
    public Mono<ApiResponse<AssistantMessage>> complete(@Valid @RequestBody QueryRequest request) {
        return agentStreamService.complete(request.message()).map(ApiResponse::success);
    }

    @GetMapping("/debug/events")
    public ApiResponse<DebugEventsResponse> debugEvents() {
        return ApiResponse.success(new DebugEventsResponse(
                agentStreamService.debugEnabled(),
                agentStreamService.debugEvents()
        ));
    }
}
