package io.github.drompincen.agentinbox.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;

/**
 * Runs a named tool on behalf of one agent in one thread. Implementations report failures
 * as {@link ToolResult#failure(String)} rather than throwing.
 */
@FunctionalInterface
public interface ToolExecutor {

    ToolExecutor NONE = (name, arguments) -> ToolResult.failure("Tool not found: " + name);

    ToolResult execute(String toolName, JsonNode arguments);
}
