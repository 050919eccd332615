package io.github.drompincen.agentinbox.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A function an agent may call while generating. Implementations are discovered through
 * {@link java.util.ServiceLoader} and must be stateless.
 */
public interface Tool {

    String name();

    /** Label shown to users while the tool runs. */
    default String displayName() {
        return name();
    }

    String description();

    /** JSON schema of the arguments object. */
    JsonNode inputSchema();

    ToolResult execute(ToolContext ctx, JsonNode input);
}
