package com.linlay.agentstream.config;

import com.linlay.agentstream.stream.marker.MarkerSplitter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.stream.marker")
public class MarkerProperties {

    private String openTag = MarkerSplitter.DEFAULT_OPEN_TAG;
    private String closeTag = MarkerSplitter.DEFAULT_CLOSE_TAG;
    private int lookahead = MarkerSplitter.DEFAULT_LOOKAHEAD;

    public String getOpenTag() {
        return openTag;
    }

    public void setOpenTag(String openTag) {
        this.openTag = openTag;
    }

    public String getCloseTag() {
        return closeTag;
    }

    public void setCloseTag(String closeTag) {
        this.closeTag = closeTag;
    }

    public int getLookahead() {
        return lookahead;
    }

    public void setLookahead(int lookahead) {
        this.lookahead = lookahead;
    }

    public MarkerSplitter newSplitter() {
        return new MarkerSplitter(openTag, closeTag, lookahead);
    }
}
