package io.github.drompincen.agentinbox.gateway.websocket;

import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.RoutingDecision;
import io.github.drompincen.agentinbox.protocol.api.ThreadSummary;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;
import io.github.drompincen.agentinbox.protocol.ws.WsMessage;
import io.github.drompincen.agentinbox.protocol.ws.WsMessageType;
import io.github.drompincen.agentinbox.runtime.notify.RealtimeNotifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * WebSocket endpoint for inbox clients. Clients subscribe to single threads or to a user's
 * whole inbox; turn progress is pushed to thread subscribers and sidebar updates to inbox
 * subscribers of the thread's owner.
 */
@Component
public class InboxWebSocketHandler extends TextWebSocketHandler implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(InboxWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Map<String, Set<WebSocketSession>> threadSubscriptions = new ConcurrentHashMap<>();
    private final Map<String, Set<WebSocketSession>> inboxSubscriptions = new ConcurrentHashMap<>();
    private final Set<WebSocketSession> allSessions = new CopyOnWriteArraySet<>();

    public InboxWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        allSessions.add(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        allSessions.remove(session);
        removeEverywhere(threadSubscriptions, session);
        removeEverywhere(inboxSubscriptions, session);
    }

    private static void removeEverywhere(Map<String, Set<WebSocketSession>> subscriptions, WebSocketSession session) {
        subscriptions.keySet().forEach(key -> remove(subscriptions, key, session));
    }

    /** Drops the key once its last session is gone. */
    private static void remove(Map<String, Set<WebSocketSession>> subscriptions, String key, WebSocketSession session) {
        subscriptions.computeIfPresent(key, (k, set) -> {
            set.remove(session);
            return set.isEmpty() ? null : set;
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String threadId = node.path("threadId").asText(null);

        switch (type) {
            case "SUBSCRIBE_THREAD" -> {
                if (threadId == null) {
                    reply(session, WsMessageType.ERROR, null, "threadId is required");
                    return;
                }
                threadSubscriptions.computeIfAbsent(threadId, k -> new CopyOnWriteArraySet<>()).add(session);
                reply(session, WsMessageType.SUBSCRIBED, threadId, null);
            }
            case "SUBSCRIBE_INBOX" -> {
                String userId = node.path("userId").asText(null);
                if (userId == null) {
                    reply(session, WsMessageType.ERROR, null, "userId is required");
                    return;
                }
                inboxSubscriptions.computeIfAbsent(userId, k -> new CopyOnWriteArraySet<>()).add(session);
                ObjectNode payload = objectMapper.createObjectNode().put("userId", userId);
                send(session, WsMessage.of(WsMessageType.SUBSCRIBED, null, payload));
            }
            case "UNSUBSCRIBE" -> {
                if (threadId != null) {
                    remove(threadSubscriptions, threadId, session);
                } else {
                    removeEverywhere(inboxSubscriptions, session);
                }
                reply(session, WsMessageType.UNSUBSCRIBED, threadId, null);
            }
            default -> reply(session, WsMessageType.ERROR, threadId, "Unknown message type: " + type);
        }
    }

    // ---- RealtimeNotifier ----

    @Override
    public void notifyTyping(String threadId, String agentId, boolean typing) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("agentId", agentId);
        payload.put("typing", typing);
        toThread(threadId, WsMessageType.TYPING, payload);
    }

    @Override
    public void notifyProcessingStage(String threadId, String stage) {
        toThread(threadId, WsMessageType.PROCESSING_STAGE, objectMapper.createObjectNode().put("stage", stage));
    }

    @Override
    public void notifyMessageCreated(String threadId, MessageDto message) {
        toThread(threadId, WsMessageType.MESSAGE_CREATED, objectMapper.valueToTree(message));
    }

    @Override
    public void notifyTextDelta(String threadId, String messageId, String delta) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("messageId", messageId);
        payload.put("delta", delta);
        toThread(threadId, WsMessageType.TEXT_DELTA, payload);
    }

    @Override
    public void notifyMessageComplete(String threadId, MessageDto message) {
        toThread(threadId, WsMessageType.MESSAGE_COMPLETE, objectMapper.valueToTree(message));
    }

    @Override
    public void notifyToolCall(String threadId, String messageId, ToolCallEvent toolCall) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("messageId", messageId);
        payload.set("toolCall", objectMapper.valueToTree(toolCall));
        toThread(threadId, WsMessageType.TOOL_CALL, payload);
    }

    @Override
    public void notifyThreadUpdated(String threadId, ThreadSummary summary) {
        WsMessage msg = WsMessage.of(WsMessageType.THREAD_UPDATED, threadId, objectMapper.valueToTree(summary));
        Set<WebSocketSession> targets = new LinkedHashSet<>(subscribers(threadSubscriptions, threadId));
        if (summary.userId() != null) {
            targets.addAll(subscribers(inboxSubscriptions, summary.userId()));
        }
        broadcast(targets, msg);
    }

    @Override
    public void notifyRoutingChanged(String threadId, RoutingDecision decision) {
        toThread(threadId, WsMessageType.ROUTING_CHANGED, objectMapper.valueToTree(decision));
    }

    @Override
    public void notifyApprovalResolved(String threadId, ApprovalDto approval) {
        toThread(threadId, WsMessageType.APPROVAL_RESOLVED, objectMapper.valueToTree(approval));
    }

    @Override
    public void notifyError(String threadId, String messageId, String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("messageId", messageId);
        payload.put("message", message);
        toThread(threadId, WsMessageType.ERROR, payload);
    }

    int subscriberCount(String threadId) {
        return subscribers(threadSubscriptions, threadId).size();
    }

    int trackedKeyCount() {
        return threadSubscriptions.size() + inboxSubscriptions.size();
    }

    private void toThread(String threadId, WsMessageType type, JsonNode payload) {
        broadcast(subscribers(threadSubscriptions, threadId), WsMessage.of(type, threadId, payload));
    }

    private static Set<WebSocketSession> subscribers(Map<String, Set<WebSocketSession>> index, String key) {
        return key == null ? Set.of() : index.getOrDefault(key, Set.of());
    }

    private void broadcast(Set<WebSocketSession> targets, WsMessage msg) {
        if (targets.isEmpty()) return;
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(msg));
        } catch (IOException e) {
            log.error("Could not serialize {} for thread {}", msg.type(), msg.threadId(), e);
            return;
        }
        for (WebSocketSession ws : targets) {
            if (!ws.isOpen()) continue;
            try {
                synchronized (ws) {
                    ws.sendMessage(frame);
                }
            } catch (IOException e) {
                log.debug("Dropping {} to closed session {}: {}", msg.type(), ws.getId(), e.getMessage());
            }
        }
    }

    private void reply(WebSocketSession session, WsMessageType type, String threadId, String error) throws IOException {
        JsonNode payload = error != null ? objectMapper.createObjectNode().put("message", error) : null;
        send(session, WsMessage.of(type, threadId, payload));
    }

    private void send(WebSocketSession session, WsMessage msg) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(msg)));
        }
    }
}
