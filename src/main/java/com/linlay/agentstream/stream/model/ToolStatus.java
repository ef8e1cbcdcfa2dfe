package com.linlay.agentstream.stream.model;

public enum ToolStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    ERROR
}
