package io.github.drompincen.agentinbox.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentinbox.runtime.tools.Tool;

public record ToolSpec(String name, String displayName, String description, JsonNode inputSchema) {

    public static ToolSpec of(Tool tool) {
        return new ToolSpec(tool.name(), tool.displayName(), tool.description(), tool.inputSchema());
    }
}
