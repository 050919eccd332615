package io.github.drompincen.agentinbox.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Lifecycle snapshot of one tool invocation inside a turn.
 */
public record ToolCallEvent(
        String id,
        String toolName,
        String displayName,
        ToolCallStatus status,
        JsonNode arguments,
        JsonNode result,
        String error,
        Instant startedAt,
        Instant finishedAt
) {
    public static ToolCallEvent running(String id, String toolName, String displayName, JsonNode arguments) {
        return new ToolCallEvent(id, toolName, displayName, ToolCallStatus.RUNNING, arguments,
                null, null, Instant.now(), null);
    }

    public ToolCallEvent completed(JsonNode result) {
        return new ToolCallEvent(id, toolName, displayName, ToolCallStatus.COMPLETED, arguments,
                result, null, startedAt, Instant.now());
    }

    public ToolCallEvent failed(String error) {
        return new ToolCallEvent(id, toolName, displayName, ToolCallStatus.FAILED, arguments,
                null, error, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == ToolCallStatus.COMPLETED;
    }
}
