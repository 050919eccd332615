package io.github.drompincen.agentinbox.protocol.api;

public record CreateThreadRequest(
        String subject,
        String agentId,
        String initialMessage
) {}
