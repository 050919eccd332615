package io.github.drompincen.agentinbox.runtime.llm;

import java.util.List;

/**
 * One entry of the provider-facing transcript.
 */
public record ChatTurn(
        Role role,
        String content,
        List<ToolCallRequest> toolCalls,
        String toolCallId,
        String toolName
) {
    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public ChatTurn {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatTurn system(String content) {
        return new ChatTurn(Role.SYSTEM, content, null, null, null);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content, null, null, null);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content, null, null, null);
    }

    public static ChatTurn assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return new ChatTurn(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static ChatTurn toolResult(String toolCallId, String toolName, String content) {
        return new ChatTurn(Role.TOOL, content, null, toolCallId, toolName);
    }
}
