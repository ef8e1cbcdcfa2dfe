package com.linlay.agentstream.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class MockWeatherTool extends AbstractDeterministicTool {

    public static final String NAME = "weather";

    private static final String[] CONDITIONS = {
            "Sunny", "Cloudy", "Partly cloudy", "Light rain", "Thunderstorm", "Fog", "Light snow"
    };

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Get weather information for a location";
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        Object rawLocation = args.get("location");
        String location = rawLocation == null || String.valueOf(rawLocation).isBlank()
                ? "Shanghai"
                : String.valueOf(rawLocation).trim();

        Random random = randomByArgs(Map.of("location", location.toLowerCase()));
        int temperatureC = random.nextInt(28) + 5;
        int humidity = 35 + random.nextInt(55);
        String condition = CONDITIONS[random.nextInt(CONDITIONS.length)];

        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("location", location);
        root.put("temperatureC", temperatureC);
        root.put("humidity", humidity);
        root.put("condition", condition);
        root.put("summary", "Weather in " + location + ": " + condition + ", " + temperatureC + "°C (Mock data)");
        return root;
    }
}
