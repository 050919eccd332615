package io.github.drompincen.agentinbox.protocol.api;

import java.time.Instant;

public record ThreadDto(
        String threadId,
        String userId,
        String subject,
        String agentId,
        String agentName,
        ThreadStatus status,
        String pendingApprovalId,
        String preview,
        int messageCount,
        int unreadCount,
        Instant lastMessageAt,
        Instant createdAt,
        Instant updatedAt
) {}
