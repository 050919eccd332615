package io.github.drompincen.agentinbox.runtime.llm;

import io.github.drompincen.agentinbox.protocol.event.TokenUsage;

import java.util.List;

/**
 * A piece of a streamed provider response. Any field may be empty; usage normally arrives
 * on the last chunk only.
 */
public record LlmChunk(String text, List<ToolCallRequest> toolCalls, TokenUsage usage) {

    public LlmChunk {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static LlmChunk text(String text) {
        return new LlmChunk(text, null, null);
    }

    public static LlmChunk toolCalls(List<ToolCallRequest> toolCalls) {
        return new LlmChunk(null, toolCalls, null);
    }

    public static LlmChunk usage(TokenUsage usage) {
        return new LlmChunk(null, null, usage);
    }
}
