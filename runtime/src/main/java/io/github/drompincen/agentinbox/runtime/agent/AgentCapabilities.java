package io.github.drompincen.agentinbox.runtime.agent;

import io.github.drompincen.agentinbox.protocol.api.AgentDto;
import io.github.drompincen.agentinbox.runtime.tools.Tool;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolRegistry;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;

import java.util.List;
import java.util.Optional;

/**
 * What an agent is allowed to do. Tools outside {@code toolNames} are invisible to the agent
 * even if the registry knows them.
 */
public record AgentCapabilities(
        String agentId,
        String name,
        String description,
        boolean generalist,
        boolean agentic,
        int maxToolCalls,
        String systemPrompt,
        List<String> toolNames
) {
    public AgentCapabilities {
        toolNames = toolNames == null ? List.of() : List.copyOf(toolNames);
    }

    public boolean hasTool(String toolName) {
        return toolNames.contains(toolName);
    }

    /** Tools the agent may call, in declaration order. Names missing from the registry are skipped. */
    public List<Tool> tools(ToolRegistry registry) {
        if (!agentic) return List.of();
        return toolNames.stream()
                .map(registry::get)
                .flatMap(Optional::stream)
                .toList();
    }

    public ToolExecutor executor(ToolRegistry registry, ToolContext ctx) {
        if (!agentic) return ToolExecutor.NONE;
        return (toolName, arguments) -> hasTool(toolName)
                ? registry.execute(toolName, ctx, arguments)
                : ToolResult.failure("Tool not found: " + toolName);
    }

    public String displayName(ToolRegistry registry, String toolName) {
        return registry.get(toolName).map(Tool::displayName).orElse(toolName);
    }

    public AgentDto toDto() {
        return new AgentDto(agentId, name, description, generalist, agentic, maxToolCalls, toolNames);
    }
}
