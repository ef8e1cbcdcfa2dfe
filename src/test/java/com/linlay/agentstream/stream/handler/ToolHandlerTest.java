package com.linlay.agentstream.stream.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.model.AgentEvent;
import com.linlay.agentstream.stream.model.HandlerOutcome;
import com.linlay.agentstream.stream.model.ToolInvocation;
import com.linlay.agentstream.stream.model.ToolStatus;
import com.linlay.agentstream.stream.session.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ToolHandlerTest {

    private SessionState state;
    private ToolHandler handler;

    @BeforeEach
    void setUp() {
        state = new SessionState();
        handler = new ToolHandler(state, new ToolValueNormalizer(new ObjectMapper()));
    }

    @Test
    void toolUseWithoutInputShouldCreatePendingEntry() {
        Optional<HandlerOutcome> outcome = handler.handle(AgentEvent.of(Map.of(
                "current_tool_use", Map.of("toolUseId", "t1", "name", "calculator")
        )));

        assertThat(state.toolInvocations()).hasSize(1);
        ToolInvocation entry = state.toolInvocations().get(0);
        assertThat(entry.toolUseId()).isEqualTo("t1");
        assertThat(entry.status()).isEqualTo(ToolStatus.PENDING);
        assertThat(outcome).get().extracting(HandlerOutcome::data)
                .isEqualTo(Map.of("name", "calculator", "toolUseId", "t1", "status", "PENDING"));
    }

    @Test
    void repeatedToolUseShouldUpdateSameEntryWithParsedInput() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t1", "name", "calculator", "input", ""))));
        handler.handle(AgentEvent.of(Map.of(
                "current_tool_use", Map.of("toolUseId", "t1", "name", "calculator", "input", "{\"expression\":\"2+2\"}")
        )));

        assertThat(state.toolInvocations()).hasSize(1);
        ToolInvocation entry = state.toolInvocations().get(0);
        assertThat(entry.input()).isEqualTo(Map.of("expression", "2+2"));
        assertThat(entry.inputStructured()).isTrue();
        assertThat(entry.status()).isEqualTo(ToolStatus.RUNNING);
    }

    @Test
    void partialJsonInputShouldStayPlainText() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t1", "name", "weather", "input", "{\"loc"))));

        ToolInvocation entry = state.toolInvocations().get(0);
        assertThat(entry.input()).isEqualTo("{\"loc");
        assertThat(entry.inputStructured()).isFalse();
    }

    @Test
    void resultShouldPreferOutputThenContent() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t1", "name", "calculator"))));
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t2", "name", "weather"))));

        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t1", "output", "42", "content", "ignored"))));
        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t2", "content", List.of(Map.of("text", "Sunny"))))));

        ToolInvocation calculator = state.tool("t1").orElseThrow();
        ToolInvocation weather = state.tool("t2").orElseThrow();
        assertThat(calculator.result()).isEqualTo("42");
        assertThat(calculator.resultStructured()).isFalse();
        assertThat(calculator.status()).isEqualTo(ToolStatus.COMPLETE);
        assertThat(weather.result()).isEqualTo(List.of(Map.of("text", "Sunny")));
        assertThat(weather.resultStructured()).isTrue();
    }

    @Test
    void resultWithoutKnownFieldsShouldDisplayRemainingMap() {
        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t9", "temperature", 21))));

        ToolInvocation entry = state.tool("t9").orElseThrow();
        assertThat(entry.result()).isEqualTo(Map.of("temperature", 21));
        assertThat(entry.name()).isEqualTo("Tool 1");
    }

    @Test
    void errorStatusShouldMarkEntryAsError() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t1", "name", "calculator"))));
        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t1", "status", "error", "output", "Invalid"))));

        assertThat(state.tool("t1").orElseThrow().status()).isEqualTo(ToolStatus.ERROR);
    }

    @Test
    void resultWithoutIdShouldAttachToLatestEntry() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("name", "weather", "input", "{\"location\":\"Oslo\"}"))));
        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("output", "Cold"))));

        assertThat(state.toolInvocations()).hasSize(1);
        assertThat(state.toolInvocations().get(0).result()).isEqualTo("Cold");
    }

    @Test
    void forceStopShouldMarkUnfinishedToolsAsError() {
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t1", "name", "calculator"))));
        handler.handle(AgentEvent.of(Map.of("current_tool_use", Map.of("toolUseId", "t2", "name", "weather"))));
        handler.handle(AgentEvent.of(Map.of("tool_result", Map.of("toolUseId", "t1", "output", "42"))));

        Optional<HandlerOutcome> outcome = handler.handle(AgentEvent.forceStop("Timeout"));

        assertThat(outcome).isPresent();
        assertThat(state.tool("t1").orElseThrow().status()).isEqualTo(ToolStatus.COMPLETE);
        assertThat(state.tool("t2").orElseThrow().status()).isEqualTo(ToolStatus.ERROR);
    }

    @Test
    void forceStopWithoutToolsShouldProduceNothing() {
        assertThat(handler.handle(AgentEvent.forceStop("broken"))).isEmpty();
    }
}
