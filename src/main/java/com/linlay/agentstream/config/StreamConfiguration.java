package com.linlay.agentstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.agent.ScriptedAgentComputation;
import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.handler.DebugHandler;
import com.linlay.agentstream.stream.session.AgentComputation;
import com.linlay.agentstream.tool.BaseTool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class StreamConfiguration {

    @Bean
    public ToolValueNormalizer toolValueNormalizer(ObjectMapper objectMapper) {
        return new ToolValueNormalizer(objectMapper);
    }

    /**
     * 调试事件缓存在所有运行之间共享，只保留最近的 max-events 条。
     */
    @Bean
    public DebugHandler debugHandler(DebugEventProperties properties) {
        return new DebugHandler(properties.isEnabled(), properties.getMaxEvents());
    }

    @Bean
    @ConditionalOnMissingBean(AgentComputation.class)
    public AgentComputation agentComputation(List<BaseTool> tools, ObjectMapper objectMapper) {
        return new ScriptedAgentComputation(tools, objectMapper);
    }
}
