package io.github.drompincen.agentinbox.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.protocol.api.ThreadStatus;
import io.github.drompincen.agentinbox.protocol.api.ThreadSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InboxWebSocketHandlerTest {

    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketSession wsSession2;

    private ObjectMapper objectMapper;
    private InboxWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        handler = new InboxWebSocketHandler(objectMapper);
        when(wsSession.isOpen()).thenReturn(true);
        when(wsSession2.isOpen()).thenReturn(true);
    }

    private void send(WebSocketSession session, Map<String, String> body) throws Exception {
        handler.handleTextMessage(session, new TextMessage(objectMapper.writeValueAsString(body)));
    }

    private List<JsonNode> framesSentTo(WebSocketSession session, int expected) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(expected)).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> {
            try {
                return objectMapper.readTree(m.getPayload());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }).toList();
    }

    @Test
    void subscribeThreadSendsAck() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));

        JsonNode ack = framesSentTo(wsSession, 1).get(0);
        assertThat(ack.path("type").asText()).isEqualTo("SUBSCRIBED");
        assertThat(ack.path("threadId").asText()).isEqualTo("t1");
        assertThat(handler.subscriberCount("t1")).isEqualTo(1);
    }

    @Test
    void textDeltaGoesOnlyToThreadSubscribers() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        send(wsSession2, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t2"));

        handler.notifyTextDelta("t1", "m1", "Hel");

        JsonNode delta = framesSentTo(wsSession, 2).get(1);
        assertThat(delta.path("type").asText()).isEqualTo("TEXT_DELTA");
        assertThat(delta.path("payload").path("messageId").asText()).isEqualTo("m1");
        assertThat(delta.path("payload").path("delta").asText()).isEqualTo("Hel");
        verify(wsSession2, times(1)).sendMessage(any());
    }

    @Test
    void threadUpdateReachesOwnersInbox() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_INBOX", "userId", "u1"));
        send(wsSession2, Map.of("type", "SUBSCRIBE_INBOX", "userId", "u2"));

        handler.notifyThreadUpdated("t1", new ThreadSummary("t1", "u1", "Q3", "Sent", "emmie", "Emmie",
                ThreadStatus.SUSPENDED, "ap-1", 1, Instant.parse("2026-03-01T12:00:00Z")));

        JsonNode update = framesSentTo(wsSession, 2).get(1);
        assertThat(update.path("type").asText()).isEqualTo("THREAD_UPDATED");
        assertThat(update.path("payload").path("pendingApprovalId").asText()).isEqualTo("ap-1");
        verify(wsSession2, times(1)).sendMessage(any());
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        send(wsSession, Map.of("type", "UNSUBSCRIBE", "threadId", "t1"));

        handler.notifyTyping("t1", "dexter", true);

        List<JsonNode> frames = framesSentTo(wsSession, 2);
        assertThat(frames.get(1).path("type").asText()).isEqualTo("UNSUBSCRIBED");
    }

    @Test
    void closedConnectionIsForgotten() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        assertThat(handler.subscriberCount("t1")).isZero();
    }

    @Test
    void emptySubscriptionEntriesAreDropped() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        send(wsSession, Map.of("type", "SUBSCRIBE_INBOX", "userId", "u1"));
        send(wsSession2, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        send(wsSession2, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t2"));
        assertThat(handler.trackedKeyCount()).isEqualTo(3);

        send(wsSession2, Map.of("type", "UNSUBSCRIBE", "threadId", "t2"));
        assertThat(handler.trackedKeyCount()).isEqualTo(2);

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);
        assertThat(handler.subscriberCount("t1")).isEqualTo(1);
        assertThat(handler.trackedKeyCount()).isEqualTo(1);

        handler.afterConnectionClosed(wsSession2, CloseStatus.NORMAL);
        assertThat(handler.trackedKeyCount()).isZero();
    }

    @Test
    void unknownMessageTypeGetsError() throws Exception {
        send(wsSession, Map.of("type", "SHOUT"));

        assertThat(framesSentTo(wsSession, 1).get(0).path("type").asText()).isEqualTo("ERROR");
    }

    @Test
    void failingSocketDoesNotAffectOthers() throws Exception {
        send(wsSession, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        send(wsSession2, Map.of("type", "SUBSCRIBE_THREAD", "threadId", "t1"));
        doThrow(new IOException("broken pipe")).when(wsSession).sendMessage(any());

        assertThatCode(() -> handler.notifyProcessingStage("t1", "thinking")).doesNotThrowAnyException();

        verify(wsSession2, times(2)).sendMessage(any());
    }
}
