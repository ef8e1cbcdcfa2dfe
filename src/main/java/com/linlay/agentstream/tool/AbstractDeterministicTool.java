package com.linlay.agentstream.tool;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Mock tools answer the same arguments with the same data.
 */
public abstract class AbstractDeterministicTool implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected Random randomByArgs(Map<String, Object> args) {
        TreeMap<String, Object> sorted = new TreeMap<>(args);
        long seed = 0;
        for (byte b : sorted.toString().getBytes(StandardCharsets.UTF_8)) {
            seed = seed * 31 + b;
        }
        return new Random(seed);
    }
}
