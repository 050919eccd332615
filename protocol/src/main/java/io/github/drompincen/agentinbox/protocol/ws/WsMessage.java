package io.github.drompincen.agentinbox.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String threadId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String threadId, JsonNode payload) {
        return new WsMessage(type, threadId, payload, Instant.now());
    }

    public static WsMessage error(String threadId, JsonNode payload) {
        return of(WsMessageType.ERROR, threadId, payload);
    }
}
