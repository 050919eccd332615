package io.github.drompincen.agentinbox.runtime.tools;

public record ToolContext(
        String threadId,
        String userId,
        String agentId
) {}
