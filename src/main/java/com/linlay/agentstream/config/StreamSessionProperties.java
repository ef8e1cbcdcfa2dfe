package com.linlay.agentstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.stream.session")
public class StreamSessionProperties {

    public static final String DEFAULT_EMPTY_RESPONSE_TEXT = "*Computation completed.*";

    private long overallTimeoutMs = 30_000;
    private long pollTimeoutMs = 1_000;
    private int queueCapacity = 1024;
    private long joinTimeoutMs = 5_000;
    private String emptyResponseText = DEFAULT_EMPTY_RESPONSE_TEXT;

    public long getOverallTimeoutMs() {
        return overallTimeoutMs;
    }

    public void setOverallTimeoutMs(long overallTimeoutMs) {
        this.overallTimeoutMs = overallTimeoutMs;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getJoinTimeoutMs() {
        return joinTimeoutMs;
    }

    public void setJoinTimeoutMs(long joinTimeoutMs) {
        this.joinTimeoutMs = joinTimeoutMs;
    }

    public String getEmptyResponseText() {
        return emptyResponseText;
    }

    public void setEmptyResponseText(String emptyResponseText) {
        this.emptyResponseText = emptyResponseText == null ? "" : emptyResponseText;
    }
}
