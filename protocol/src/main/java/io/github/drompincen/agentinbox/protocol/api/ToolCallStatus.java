package io.github.drompincen.agentinbox.protocol.api;

public enum ToolCallStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
