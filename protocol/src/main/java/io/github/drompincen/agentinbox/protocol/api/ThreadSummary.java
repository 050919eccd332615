package io.github.drompincen.agentinbox.protocol.api;

import java.time.Instant;

/** Sidebar view of a thread pushed on every thread update. */
public record ThreadSummary(
        String threadId,
        String userId,
        String subject,
        String preview,
        String agentId,
        String agentName,
        ThreadStatus status,
        String pendingApprovalId,
        int unreadCount,
        Instant lastMessageAt
) {}
