package io.github.drompincen.agentinbox.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            register(tool);
        }
        log.info("Loaded {} tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /**
     * Runs a tool by name. Unknown tools and tool exceptions come back as failed results.
     */
    public ToolResult execute(String name, ToolContext ctx, JsonNode input) {
        Optional<Tool> tool = get(name);
        if (tool.isEmpty()) {
            return ToolResult.failure("Tool not found: " + name);
        }
        try {
            ToolResult result = tool.get().execute(ctx, input);
            return result != null ? result : ToolResult.failure("Tool returned no result: " + name);
        } catch (Exception e) {
            log.warn("Tool {} failed in thread {}: {}", name, ctx != null ? ctx.threadId() : null, e.getMessage());
            return ToolResult.failure("Error: " + e.getMessage());
        }
    }
}
