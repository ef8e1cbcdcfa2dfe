package com.linlay.agentstream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentstream.config.MarkerProperties;
import com.linlay.agentstream.config.StreamSessionProperties;
import com.linlay.agentstream.stream.StreamSessionFactory;
import com.linlay.agentstream.stream.assemble.ToolValueNormalizer;
import com.linlay.agentstream.stream.handler.DebugHandler;
import com.linlay.agentstream.stream.model.AgentResult;
import com.linlay.agentstream.stream.model.StreamEvent;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentStreamServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AgentStreamService service() {
        StreamSessionProperties properties = new StreamSessionProperties();
        properties.setPollTimeoutMs(50);
        StreamSessionFactory factory = new StreamSessionFactory(
                (input, listener) -> {
                    listener.onEvent(Map.of("data", "Echo: " + input + " and a little more"));
                    return AgentResult.of("Echo: " + input);
                },
                properties,
                new MarkerProperties(),
                new ToolValueNormalizer(objectMapper),
                new DebugHandler(false, 10)
        );
        return new AgentStreamService(factory, objectMapper);
    }

    @Test
    void eachStreamShouldUseItsOwnRun() {
        AgentStreamService service = service();

        List<StreamEvent> first = service.stream("one").collectList().block(Duration.ofSeconds(10));
        List<StreamEvent> second = service.stream("two").collectList().block(Duration.ofSeconds(10));

        assertThat(first.get(0).runId()).isNotEqualTo(second.get(0).runId());
        assertThat(second.get(0).payload()).containsEntry("delta", "Echo: two and a little more");
    }

    @Test
    void sseFramesShouldCarrySerializedEventData() throws Exception {
        List<ServerSentEvent<String>> frames = service().streamSse("hi").collectList().block(Duration.ofSeconds(10));

        assertThat(frames).isNotEmpty();
        assertThat(frames).allSatisfy(frame -> assertThat(frame.event()).isEqualTo("message"));
        Map<?, ?> last = objectMapper.readValue(frames.get(frames.size() - 1).data(), Map.class);
        assertThat(last.get("type")).isEqualTo(StreamEvent.MESSAGE_FINAL);
        assertThat(last.get("seq")).isEqualTo(frames.size());
    }

    @Test
    void blankMessageShouldFailFast() {
        assertThatThrownBy(() -> service().complete("  ").block(Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
