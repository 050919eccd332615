package io.github.drompincen.agentinbox.protocol.api;

public enum ThreadStatus {
    ACTIVE,
    SUSPENDED,
    ARCHIVED
}
