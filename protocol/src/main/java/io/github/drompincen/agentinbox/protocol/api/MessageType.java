package io.github.drompincen.agentinbox.protocol.api;

public enum MessageType {
    TEXT,
    SYSTEM_EVENT,
    APPROVAL_REQUEST
}
