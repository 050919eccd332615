package io.github.drompincen.agentinbox.runtime.inbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.ThreadDto;
import io.github.drompincen.agentinbox.protocol.api.ThreadSummary;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;
import io.github.drompincen.agentinbox.protocol.api.ToolCallStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Document to DTO conversion. Tool call payloads are stored as plain maps so they stay
 * queryable in Mongo.
 */
@Component
public class InboxMapper {

    private final ObjectMapper objectMapper;

    public InboxMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ThreadDto toDto(ThreadDocument doc) {
        return new ThreadDto(doc.getThreadId(), doc.getUserId(), doc.getSubject(), doc.getAgentId(),
                doc.getAgentName(), doc.getStatus(), doc.getPendingApprovalId(), doc.getPreview(),
                doc.getMessageCount(), doc.getUnreadCount(), doc.getLastMessageAt(),
                doc.getCreatedAt(), doc.getUpdatedAt());
    }

    public ThreadSummary toSummary(ThreadDocument doc) {
        return new ThreadSummary(doc.getThreadId(), doc.getUserId(), doc.getSubject(), doc.getPreview(),
                doc.getAgentId(), doc.getAgentName(), doc.getStatus(), doc.getPendingApprovalId(),
                doc.getUnreadCount(), doc.getLastMessageAt());
    }

    public MessageDto toDto(MessageDocument doc) {
        List<ToolCallEvent> toolCalls = doc.getToolCalls() == null ? List.of()
                : doc.getToolCalls().stream().map(this::toEvent).toList();
        return new MessageDto(doc.getMessageId(), doc.getThreadId(), doc.getSeq(), doc.getRole(),
                doc.getType(), doc.getContent(), doc.getAgentId(), doc.getAgentName(), toolCalls,
                doc.getApprovalId(), doc.getApprovalStatus(), doc.getTimestamp());
    }

    public ApprovalDto toDto(ApprovalDocument doc) {
        int queued = doc.getQueuedActions() == null ? 0 : doc.getQueuedActions().size();
        return new ApprovalDto(doc.getApprovalId(), doc.getThreadId(), doc.getMessageId(), doc.getActionType(),
                doc.getParams(), doc.getPreview(), doc.getStatus(), doc.getResolvedBy(), doc.getResolvedAt(),
                doc.getComment(), queued, doc.getCreatedAt());
    }

    public MessageDocument.ToolCallRecord toRecord(ToolCallEvent event) {
        MessageDocument.ToolCallRecord rec = new MessageDocument.ToolCallRecord();
        rec.setId(event.id());
        rec.setToolName(event.toolName());
        rec.setDisplayName(event.displayName());
        rec.setStatus(event.status().name());
        rec.setArguments(plain(event.arguments()));
        rec.setResult(plain(event.result()));
        rec.setError(event.error());
        rec.setStartedAt(event.startedAt());
        rec.setFinishedAt(event.finishedAt());
        return rec;
    }

    public ToolCallEvent toEvent(MessageDocument.ToolCallRecord rec) {
        return new ToolCallEvent(rec.getId(), rec.getToolName(), rec.getDisplayName(),
                rec.getStatus() != null ? ToolCallStatus.valueOf(rec.getStatus()) : ToolCallStatus.COMPLETED,
                json(rec.getArguments()), json(rec.getResult()), rec.getError(),
                rec.getStartedAt(), rec.getFinishedAt());
    }

    private Object plain(JsonNode node) {
        return node == null || node.isNull() ? null : objectMapper.convertValue(node, Object.class);
    }

    private JsonNode json(Object value) {
        return value == null ? null : objectMapper.valueToTree(value);
    }
}
