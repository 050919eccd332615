package io.github.drompincen.agentinbox.persistence.document;

import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.MessageType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document(collection = "messages")
@CompoundIndex(name = "thread_seq", def = "{'threadId': 1, 'seq': 1}", unique = true)
public class MessageDocument {

    @Id
    private String messageId;
    private String threadId;
    private long seq;
    private MessageRole role;
    private MessageType type;
    private String content;
    private String agentId;
    private String agentName;
    private List<ToolCallRecord> toolCalls;
    private String approvalId;
    private ApprovalStatus approvalStatus;
    private Instant timestamp;

    public MessageDocument() {}

    /** Final state of a tool call made while this message was generated. */
    public static class ToolCallRecord {
        private String id;
        private String toolName;
        private String displayName;
        private String status;    // RUNNING, COMPLETED or FAILED
        private Object arguments;
        private Object result;
        private String error;
        private Instant startedAt;
        private Instant finishedAt;

        public ToolCallRecord() {}

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getToolName() { return toolName; }
        public void setToolName(String toolName) { this.toolName = toolName; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public Object getArguments() { return arguments; }
        public void setArguments(Object arguments) { this.arguments = arguments; }

        public Object getResult() { return result; }
        public void setResult(Object result) { this.result = result; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public Instant getStartedAt() { return startedAt; }
        public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

        public Instant getFinishedAt() { return finishedAt; }
        public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public MessageRole getRole() { return role; }
    public void setRole(MessageRole role) { this.role = role; }

    public MessageType getType() { return type; }
    public void setType(MessageType type) { this.type = type; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public List<ToolCallRecord> getToolCalls() { return toolCalls; }
    public void setToolCalls(List<ToolCallRecord> toolCalls) { this.toolCalls = toolCalls; }

    public String getApprovalId() { return approvalId; }
    public void setApprovalId(String approvalId) { this.approvalId = approvalId; }

    public ApprovalStatus getApprovalStatus() { return approvalStatus; }
    public void setApprovalStatus(ApprovalStatus approvalStatus) { this.approvalStatus = approvalStatus; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
