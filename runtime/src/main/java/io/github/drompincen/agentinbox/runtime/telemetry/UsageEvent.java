package io.github.drompincen.agentinbox.runtime.telemetry;

import io.github.drompincen.agentinbox.protocol.event.TokenUsage;

import java.time.Instant;

/**
 * Usage of one completed or failed turn.
 */
public record UsageEvent(
        String threadId,
        String agentId,
        String provider,
        String model,
        int messageCount,
        TokenUsage usage,
        int toolCallCount,
        long durationMs,
        boolean success,
        String errorMessage,
        Instant timestamp
) {
    public UsageEvent {
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
