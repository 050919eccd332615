package io.github.drompincen.agentinbox.persistence.document;

import io.github.drompincen.agentinbox.protocol.api.ThreadState;
import io.github.drompincen.agentinbox.protocol.api.ThreadStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A conversation between one user and the agents of the inbox.
 *
 * <p>{@code status} and {@code pendingApprovalId} are only written together through
 * {@link #setState(ThreadState)}, so a suspended thread always points at its approval.
 */
@Document(collection = "threads")
@CompoundIndex(name = "user_last_message", def = "{'userId': 1, 'lastMessageAt': -1}")
public class ThreadDocument {

    @Id
    private String threadId;
    private String userId;
    private String subject;
    private String agentId;
    private String agentName;
    private ThreadStatus status = ThreadStatus.ACTIVE;
    private String pendingApprovalId;
    private String preview;
    private int messageCount;
    private int unreadCount;
    private Instant lastMessageAt;
    private Instant createdAt;
    private Instant updatedAt;

    public ThreadDocument() {}

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public ThreadState getState() { return ThreadState.of(status, pendingApprovalId); }
    public void setState(ThreadState state) {
        this.status = state.status();
        this.pendingApprovalId = state.pendingApprovalId().orElse(null);
    }

    public ThreadStatus getStatus() { return status; }

    public String getPendingApprovalId() { return pendingApprovalId; }

    public String getPreview() { return preview; }
    public void setPreview(String preview) { this.preview = preview; }

    public int getMessageCount() { return messageCount; }
    public void setMessageCount(int messageCount) { this.messageCount = messageCount; }

    public int getUnreadCount() { return unreadCount; }
    public void setUnreadCount(int unreadCount) { this.unreadCount = unreadCount; }

    public Instant getLastMessageAt() { return lastMessageAt; }
    public void setLastMessageAt(Instant lastMessageAt) { this.lastMessageAt = lastMessageAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
