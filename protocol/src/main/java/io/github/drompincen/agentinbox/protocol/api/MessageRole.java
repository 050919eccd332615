package io.github.drompincen.agentinbox.protocol.api;

public enum MessageRole {
    USER,
    AGENT,
    SYSTEM;

    public static MessageRole fromWire(String role) {
        if (role == null || role.isBlank()) return USER;
        return switch (role.trim().toLowerCase()) {
            case "agent", "assistant" -> AGENT;
            case "system" -> SYSTEM;
            case "user" -> USER;
            default -> throw new IllegalArgumentException("Unknown message role: " + role);
        };
    }
}
