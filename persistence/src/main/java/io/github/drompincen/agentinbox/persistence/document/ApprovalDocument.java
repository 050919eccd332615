package io.github.drompincen.agentinbox.persistence.document;

import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Document(collection = "approvals")
@CompoundIndexes({
        @CompoundIndex(name = "thread_status", def = "{'threadId': 1, 'status': 1}"),
        @CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1, 'createdAt': -1}")
})
public class ApprovalDocument {

    @Id
    private String approvalId;
    private String threadId;
    private String messageId;
    private String userId;
    private String actionType;
    private Map<String, Object> params;
    private String preview;
    private ApprovalStatus status;
    private String resolvedBy;
    private Instant resolvedAt;
    private String comment;
    private List<QueuedAction> queuedActions = new ArrayList<>();
    private Instant createdAt;

    public ApprovalDocument() {}

    /** An approval-requiring action waiting behind this one. */
    public static class QueuedAction {
        private String actionType;
        private Map<String, Object> params;
        private String preview;
        private String messageId;

        public QueuedAction() {}

        public QueuedAction(String actionType, Map<String, Object> params, String preview, String messageId) {
            this.actionType = actionType;
            this.params = params;
            this.preview = preview;
            this.messageId = messageId;
        }

        public String getActionType() { return actionType; }
        public void setActionType(String actionType) { this.actionType = actionType; }

        public Map<String, Object> getParams() { return params; }
        public void setParams(Map<String, Object> params) { this.params = params; }

        public String getPreview() { return preview; }
        public void setPreview(String preview) { this.preview = preview; }

        public String getMessageId() { return messageId; }
        public void setMessageId(String messageId) { this.messageId = messageId; }
    }

    public String getApprovalId() { return approvalId; }
    public void setApprovalId(String approvalId) { this.approvalId = approvalId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getActionType() { return actionType; }
    public void setActionType(String actionType) { this.actionType = actionType; }

    public Map<String, Object> getParams() { return params; }
    public void setParams(Map<String, Object> params) { this.params = params; }

    public String getPreview() { return preview; }
    public void setPreview(String preview) { this.preview = preview; }

    public ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalStatus status) { this.status = status; }

    public String getResolvedBy() { return resolvedBy; }
    public void setResolvedBy(String resolvedBy) { this.resolvedBy = resolvedBy; }

    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }

    public List<QueuedAction> getQueuedActions() { return queuedActions; }
    public void setQueuedActions(List<QueuedAction> queuedActions) { this.queuedActions = queuedActions; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
