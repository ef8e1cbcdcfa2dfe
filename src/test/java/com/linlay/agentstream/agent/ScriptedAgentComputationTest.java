package com.linlay.agentstream.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.tool.MockCalculatorTool;
import com.linlay.agentstream.tool.MockWeatherTool;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptedAgentComputationTest {

    private final ScriptedAgentComputation computation = new ScriptedAgentComputation(
            List.of(new MockCalculatorTool(), new MockWeatherTool()),
            new ObjectMapper()
    );

    @Test
    void planShouldPickToolsFromPrompt() {
        assertThat(computation.plan("What is (2 + 3) * 4?"))
                .containsExactly(new ScriptedAgentComputation.PlannedCall("calculator", Map.of("expression", "(2 + 3) * 4")));
        assertThat(computation.plan("How is the weather in Paris?"))
                .containsExactly(new ScriptedAgentComputation.PlannedCall("weather", Map.of("location", "Paris")));
        assertThat(computation.plan("Tell me a joke")).isEmpty();
    }

    @Test
    void invokeShouldStreamThinkingToolEventsAndAnswer() throws Exception {
        List<Map<String, Object>> events = new ArrayList<>();

        AgentResult result = computation.invoke("What is 6 * 7?", events::add);

        String streamed = events.stream()
                .filter(event -> event.containsKey("data"))
                .map(event -> (String) event.get("data"))
                .reduce("", String::concat);
        assertThat(streamed).startsWith("<thinking>").contains("</thinking>").endsWith("The result of 6 * 7 is 42.");
        assertThat(events).filteredOn(event -> event.containsKey("current_tool_use")).hasSize(2);
        assertThat(events).filteredOn(event -> event.containsKey("tool_result")).hasSize(1);
        assertThat(events.get(0)).containsKey("init_event_loop");
        assertThat(result.toolMetrics()).singleElement()
                .satisfies(metric -> assertThat(metric.input()).isEqualTo(Map.of("expression", "6 * 7")));
    }

    @Test
    void invalidExpressionShouldProduceErrorResult() throws Exception {
        List<Map<String, Object>> events = new ArrayList<>();

        computation.invoke("Compute 1 / 0 please", events::add);

        assertThat(events).filteredOn(event -> event.containsKey("tool_result"))
                .singleElement()
                .satisfies(event -> assertThat(event.get("tool_result"))
                        .asInstanceOf(InstanceOfAssertFactories.MAP)
                        .containsEntry("status", "error"));
    }
}
