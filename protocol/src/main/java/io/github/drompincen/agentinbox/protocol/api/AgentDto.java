package io.github.drompincen.agentinbox.protocol.api;

import java.util.List;

public record AgentDto(
        String agentId,
        String name,
        String description,
        boolean generalist,
        boolean agentic,
        int maxToolCalls,
        List<String> tools
) {}
