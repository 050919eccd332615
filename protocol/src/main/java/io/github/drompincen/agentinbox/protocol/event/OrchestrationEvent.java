package io.github.drompincen.agentinbox.protocol.event;

import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;

import java.util.List;

/**
 * One step of a streamed turn. A turn emits text deltas and tool call pairs in order and
 * ends with exactly one {@link Done} or one {@link StreamError}.
 */
public sealed interface OrchestrationEvent {

    record TextDelta(String text) implements OrchestrationEvent {}

    record ToolCallStarted(ToolCallEvent call) implements OrchestrationEvent {}

    record ToolCallResult(ToolCallEvent call) implements OrchestrationEvent {}

    record StreamError(String message, boolean retryable, String text, TokenUsage usage)
            implements OrchestrationEvent {}

    record Done(String text, List<ToolCallEvent> toolCalls, StopReason stopReason, TokenUsage usage)
            implements OrchestrationEvent {
        public Done {
            toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        }
    }

    default boolean isTerminal() {
        return this instanceof Done || this instanceof StreamError;
    }
}
