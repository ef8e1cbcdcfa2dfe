package com.linlay.agentstream.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    JsonNode invoke(Map<String, Object> args);
}
