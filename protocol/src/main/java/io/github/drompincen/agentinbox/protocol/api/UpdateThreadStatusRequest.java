package io.github.drompincen.agentinbox.protocol.api;

public record UpdateThreadStatusRequest(ThreadStatus status) {}
