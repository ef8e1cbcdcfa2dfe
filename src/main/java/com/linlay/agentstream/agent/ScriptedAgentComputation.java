package com.linlay.agentstream.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.session.AgentComputation;
import com.linlay.agentstream.stream.session.AgentEventListener;
import com.linlay.agentstream.tool.BaseTool;
import com.linlay.agentstream.tool.MockCalculatorTool;
import com.linlay.agentstream.tool.MockWeatherTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 本地演示用的智能体：先输出一段 thinking 标记包裹的推理，再按提示词调用计算器或天气工具，
 * 最后分块输出回答。接入真实模型时以自定义 {@link AgentComputation} Bean 替换。
 */
public class ScriptedAgentComputation implements AgentComputation {

    private static final Logger log = LoggerFactory.getLogger(ScriptedAgentComputation.class);

    public static final String OPEN_TAG = "<thinking>";
    public static final String CLOSE_TAG = "</thinking>";
    public static final int CHUNK_SIZE = 12;

    private static final Pattern EXPRESSION = Pattern.compile(
            "\\(*\\s*\\d+(?:\\.\\d+)?(?:\\s*[-+*/]\\s*\\(*\\s*\\d+(?:\\.\\d+)?\\s*\\)*)+"
    );
    private static final Pattern WEATHER = Pattern.compile(
            "(?i)\\bweather\\b(?:\\s+(?:in|for|at)\\s+([\\p{L}][\\p{L} .'-]*))?"
    );

    private final Map<String, BaseTool> toolsByName;
    private final ObjectMapper objectMapper;

    public ScriptedAgentComputation(List<BaseTool> tools, ObjectMapper objectMapper) {
        this.toolsByName = tools.stream()
                .collect(Collectors.toMap(BaseTool::name, Function.identity(), (left, right) -> left, LinkedHashMap::new));
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public AgentResult invoke(String input, AgentEventListener listener) throws Exception {
        String prompt = input == null ? "" : input.trim();
        listener.onEvent(Map.of("init_event_loop", true));
        listener.onEvent(Map.of("start", true));

        List<PlannedCall> calls = plan(prompt);
        streamText(listener, OPEN_TAG + reasoning(prompt, calls) + CLOSE_TAG);

        List<AgentResult.ToolMetric> metrics = new ArrayList<>();
        List<String> sentences = new ArrayList<>();
        int index = 0;
        for (PlannedCall call : calls) {
            String toolUseId = "tooluse_" + (++index);
            listener.onEvent(Map.of("current_tool_use", Map.of("toolUseId", toolUseId, "name", call.tool(), "input", "")));
            listener.onEvent(Map.of("current_tool_use", Map.of(
                    "toolUseId", toolUseId,
                    "name", call.tool(),
                    "input", objectMapper.writeValueAsString(call.args())
            )));
            sentences.add(runTool(call, toolUseId, listener));
            metrics.add(new AgentResult.ToolMetric(toolUseId, call.tool(), call.args()));
        }

        String answer = sentences.isEmpty() ? "You said: " + prompt : String.join(" ", sentences);
        streamText(listener, answer);
        listener.onEvent(Map.of("complete", true));

        Map<String, Object> message = Map.of(
                "role", "assistant",
                "content", List.of(Map.of("text", answer))
        );
        return new AgentResult(message, metrics, Map.of("outputTokens", answer.length() / 4 + 1));
    }

    List<PlannedCall> plan(String prompt) {
        List<PlannedCall> calls = new ArrayList<>();
        Matcher expression = EXPRESSION.matcher(prompt);
        if (expression.find() && toolsByName.containsKey(MockCalculatorTool.NAME)) {
            calls.add(new PlannedCall(MockCalculatorTool.NAME, Map.of("expression", expression.group().trim())));
        }
        Matcher weather = WEATHER.matcher(prompt);
        if (weather.find() && toolsByName.containsKey(MockWeatherTool.NAME)) {
            String location = weather.group(1) == null ? "Shanghai" : weather.group(1).trim().replaceAll("[ .'-]+$", "");
            calls.add(new PlannedCall(MockWeatherTool.NAME, Map.of("location", location)));
        }
        return calls;
    }

    private String runTool(PlannedCall call, String toolUseId, AgentEventListener listener) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("toolUseId", toolUseId);
        String sentence;
        try {
            JsonNode output = toolsByName.get(call.tool()).invoke(call.args());
            result.put("status", "success");
            result.put("output", output);
            sentence = describe(call, output);
        } catch (IllegalArgumentException ex) {
            log.debug("tool call rejected tool={}, error={}", call.tool(), ex.getMessage());
            result.put("status", "error");
            result.put("output", "Error: " + ex.getMessage());
            sentence = "The " + call.tool() + " tool could not answer: " + ex.getMessage() + ".";
        }
        listener.onEvent(Map.of("tool_result", result));
        return sentence;
    }

    private String describe(PlannedCall call, JsonNode output) {
        if (MockCalculatorTool.NAME.equals(call.tool())) {
            return "The result of " + output.path("expression").asText() + " is " + output.path("result").asText() + ".";
        }
        return output.path("summary").asText(output.toString()) + ".";
    }

    private String reasoning(String prompt, List<PlannedCall> calls) {
        if (calls.isEmpty()) {
            return "The request \"" + prompt + "\" needs no tools, so I will answer directly.";
        }
        String names = calls.stream().map(PlannedCall::tool).collect(Collectors.joining(" and "));
        return "The request \"" + prompt + "\" needs the " + names + " tool.";
    }

    private void streamText(AgentEventListener listener, String text) {
        for (int start = 0; start < text.length(); start += CHUNK_SIZE) {
            listener.onEvent(Map.of("data", text.substring(start, Math.min(text.length(), start + CHUNK_SIZE))));
        }
    }

    record PlannedCall(String tool, Map<String, Object> args) {
    }
}
