package io.github.drompincen.agentinbox.runtime.inbox;

import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import io.github.drompincen.agentinbox.persistence.repository.MessageRepository;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.MessageType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Appends messages to a thread with the next sequence number.
 */
@Component
public class MessageStore {

    private final MessageRepository messageRepository;

    public MessageStore(MessageRepository messageRepository) {
        this.messageRepository = messageRepository;
    }

    public MessageDocument append(String threadId, MessageRole role, MessageType type, String content,
                                  String agentId, String agentName) {
        MessageDocument doc = new MessageDocument();
        doc.setMessageId(UUID.randomUUID().toString());
        doc.setThreadId(threadId);
        doc.setSeq(nextSeq(threadId));
        doc.setRole(role);
        doc.setType(type);
        doc.setContent(content);
        doc.setAgentId(agentId);
        doc.setAgentName(agentName);
        doc.setTimestamp(Instant.now());
        return messageRepository.save(doc);
    }

    public long nextSeq(String threadId) {
        return messageRepository.findTopByThreadIdOrderBySeqDesc(threadId)
                .map(m -> m.getSeq() + 1)
                .orElse(1L);
    }
}
