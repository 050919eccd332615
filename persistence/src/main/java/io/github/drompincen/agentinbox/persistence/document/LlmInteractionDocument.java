package io.github.drompincen.agentinbox.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One generation turn as seen by usage telemetry: tokens, latency and outcome.
 */
@Document(collection = "llm_interactions")
@CompoundIndex(name = "thread_time", def = "{'threadId': 1, 'timestamp': -1}")
public class LlmInteractionDocument {

    @Id
    private String interactionId;
    private String threadId;
    private String agentId;
    private String provider;          // e.g. "openai"
    private String model;
    private int messageCount;         // messages in the prompt
    private int promptTokens;
    private int completionTokens;
    private boolean tokensEstimated;  // true when derived from text length
    private int toolCallCount;
    private long durationMs;
    private boolean success;
    private String errorMessage;
    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant timestamp;

    public LlmInteractionDocument() {}

    public String getInteractionId() { return interactionId; }
    public void setInteractionId(String interactionId) { this.interactionId = interactionId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getMessageCount() { return messageCount; }
    public void setMessageCount(int messageCount) { this.messageCount = messageCount; }

    public int getPromptTokens() { return promptTokens; }
    public void setPromptTokens(int promptTokens) { this.promptTokens = promptTokens; }

    public int getCompletionTokens() { return completionTokens; }
    public void setCompletionTokens(int completionTokens) { this.completionTokens = completionTokens; }

    public boolean isTokensEstimated() { return tokensEstimated; }
    public void setTokensEstimated(boolean tokensEstimated) { this.tokensEstimated = tokensEstimated; }

    public int getToolCallCount() { return toolCallCount; }
    public void setToolCallCount(int toolCallCount) { this.toolCallCount = toolCallCount; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
