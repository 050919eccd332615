package io.github.drompincen.agentinbox.protocol.api;

import java.time.Instant;
import java.util.List;

public record MessageDto(
        String messageId,
        String threadId,
        long seq,
        MessageRole role,
        MessageType type,
        String content,
        String agentId,
        String agentName,
        List<ToolCallEvent> toolCalls,
        String approvalId,
        ApprovalStatus approvalStatus,
        Instant timestamp
) {}
