package io.github.drompincen.agentinbox.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error,
        String summary
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, null);
    }

    public static ToolResult success(JsonNode output, String summary) {
        return new ToolResult(true, output, null, summary);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null);
    }
}
