package io.github.drompincen.agentinbox.protocol.ws;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.TEXT_DELTA, "thread-1", new TextNode("chunk"));

        assertThat(msg.type()).isEqualTo(WsMessageType.TEXT_DELTA);
        assertThat(msg.threadId()).isEqualTo("thread-1");
        assertThat(msg.payload().asText()).isEqualTo("chunk");
        assertThat(msg.ts()).isNotNull();
    }

    @Test
    void errorFactoryCreatesErrorMessage() {
        WsMessage msg = WsMessage.error("thread-1", new TextNode("something went wrong"));

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.threadId()).isEqualTo("thread-1");
    }

    @Test
    void wsMessageTypesIncludeClientAndServerTypes() {
        assertThat(WsMessageType.valueOf("SUBSCRIBE_THREAD")).isNotNull();
        assertThat(WsMessageType.valueOf("SUBSCRIBE_INBOX")).isNotNull();
        assertThat(WsMessageType.valueOf("ROUTING_CHANGED")).isNotNull();
        assertThat(WsMessageType.valueOf("APPROVAL_RESOLVED")).isNotNull();
        assertThat(WsMessageType.valueOf("SUBSCRIBED")).isNotNull();
    }
}
