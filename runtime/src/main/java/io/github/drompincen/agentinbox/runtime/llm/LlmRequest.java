package io.github.drompincen.agentinbox.runtime.llm;

import java.util.List;

public record LlmRequest(
        String threadId,
        String agentId,
        List<ChatTurn> messages,
        List<ToolSpec> tools
) {
    public LlmRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public int promptChars() {
        return messages.stream().mapToInt(m -> m.content().length()).sum();
    }
}
