package io.github.drompincen.agentinbox.runtime.llm;

/**
 * A tool call requested by the model. {@code arguments} is the raw JSON text the model produced
 * and is not guaranteed to parse.
 */
public record ToolCallRequest(String id, String name, String arguments) {}
