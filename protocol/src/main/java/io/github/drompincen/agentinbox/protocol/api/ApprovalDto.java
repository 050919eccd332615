package io.github.drompincen.agentinbox.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ApprovalDto(
        String approvalId,
        String threadId,
        String messageId,
        String actionType,
        Map<String, Object> params,
        String preview,
        ApprovalStatus status,
        String resolvedBy,
        Instant resolvedAt,
        String comment,
        int queuedActions,
        Instant createdAt
) {}
