package io.github.drompincen.agentinbox.runtime.orchestration;

import io.github.drompincen.agentinbox.runtime.agent.ToolExecutor;
import io.github.drompincen.agentinbox.runtime.llm.ChatTurn;
import io.github.drompincen.agentinbox.runtime.llm.ToolSpec;

import java.util.List;

/**
 * Input of one streamed turn.
 *
 * @param history      prior user and agent messages, oldest first, excluding {@code userText}
 * @param maxToolCalls tool invocations allowed for the whole turn
 */
public record OrchestrationRequest(
        String threadId,
        String agentId,
        String systemPrompt,
        List<ChatTurn> history,
        String userText,
        List<ToolSpec> tools,
        ToolExecutor toolExecutor,
        int maxToolCalls
) {
    public OrchestrationRequest {
        history = history == null ? List.of() : List.copyOf(history);
        tools = tools == null ? List.of() : List.copyOf(tools);
        toolExecutor = toolExecutor == null ? ToolExecutor.NONE : toolExecutor;
    }

    String displayName(String toolName) {
        return tools.stream()
                .filter(t -> t.name().equals(toolName))
                .map(ToolSpec::displayName)
                .findFirst()
                .orElse(toolName);
    }
}
