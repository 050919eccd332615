package io.github.drompincen.agentinbox.protocol.api;

public record SendMessageRequest(
        String content,
        String role
) {
    public SendMessageRequest(String content) {
        this(content, "user");
    }
}
