package io.github.drompincen.agentinbox.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_THREAD,
    SUBSCRIBE_INBOX,
    UNSUBSCRIBE,

    // Server -> Client
    TYPING,
    PROCESSING_STAGE,
    MESSAGE_CREATED,
    TEXT_DELTA,
    MESSAGE_COMPLETE,
    TOOL_CALL,
    THREAD_UPDATED,
    ROUTING_CHANGED,
    APPROVAL_RESOLVED,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
