package com.linlay.agentstream.stream.session;

public enum SessionStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FORCE_STOPPED,
    TIMED_OUT,
    DRAINED
}
