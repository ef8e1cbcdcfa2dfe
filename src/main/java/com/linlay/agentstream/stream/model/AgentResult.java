package com.linlay.agentstream.stream.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Return value of one agent computation.
 *
 * @param message     final assistant message; a plain string or a map with {@code content}
 * @param toolMetrics per-tool metrics gathered by the computation, used to backfill tool inputs
 * @param usage       optional token usage counters
 */
public record AgentResult(
        Object message,
        List<ToolMetric> toolMetrics,
        Map<String, Object> usage
) {

    public AgentResult {
        toolMetrics = toolMetrics == null ? List.of() : List.copyOf(toolMetrics);
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static AgentResult of(Object message) {
        return new AgentResult(message, List.of(), Map.of());
    }

    public static AgentResult of(Object message, List<ToolMetric> toolMetrics) {
        return new AgentResult(message, toolMetrics, Map.of());
    }

    public static AgentResult empty() {
        return new AgentResult(null, List.of(), Map.of());
    }

    /**
     * Accepts either an {@code AgentResult} or a loosely typed map of the form
     * {@code {message, metrics: {tool_metrics: [{tool: {toolUseId, name, input}}]}}}.
     */
    public static AgentResult from(Object raw) {
        if (raw instanceof AgentResult result) {
            return result;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return of(raw);
        }
        List<ToolMetric> metrics = new ArrayList<>();
        Object metricsNode = map.get("metrics");
        Object toolMetrics = metricsNode instanceof Map<?, ?> metricsMap ? metricsMap.get("tool_metrics") : null;
        Collection<?> entries = toolMetrics instanceof Map<?, ?> byName
                ? byName.values()
                : toolMetrics instanceof Collection<?> list ? list : List.of();
        for (Object entry : entries) {
            Object tool = entry instanceof Map<?, ?> entryMap ? entryMap.get("tool") : null;
            if (tool instanceof Map<?, ?> toolMap) {
                metrics.add(new ToolMetric(
                        text(firstNonNull(toolMap.get("toolUseId"), toolMap.get("tool_use_id"))),
                        text(toolMap.get("name")),
                        firstNonNull(toolMap.get("input"), toolMap.get("arguments"))
                ));
            }
        }
        Object usage = map.get("usage");
        return new AgentResult(map.get("message"), metrics, usage instanceof Map<?, ?> usageMap ? copyKeys(usageMap) : null);
    }

    private static Object firstNonNull(Object first, Object second) {
        return first != null ? first : second;
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> copyKeys(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    public record ToolMetric(
            String toolUseId,
            String name,
            Object input
    ) {
    }
}
