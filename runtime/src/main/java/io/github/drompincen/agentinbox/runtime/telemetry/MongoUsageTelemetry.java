package io.github.drompincen.agentinbox.runtime.telemetry;

import io.github.drompincen.agentinbox.persistence.document.LlmInteractionDocument;
import io.github.drompincen.agentinbox.persistence.repository.LlmInteractionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Stores usage events as {@code llm_interactions} rows.
 */
@Service
public class MongoUsageTelemetry implements UsageTelemetry {

    private static final Logger log = LoggerFactory.getLogger(MongoUsageTelemetry.class);

    private final LlmInteractionRepository llmInteractionRepository;

    public MongoUsageTelemetry(LlmInteractionRepository llmInteractionRepository) {
        this.llmInteractionRepository = llmInteractionRepository;
    }

    @Override
    public void record(UsageEvent event) {
        LlmInteractionDocument doc = new LlmInteractionDocument();
        doc.setInteractionId(UUID.randomUUID().toString());
        doc.setThreadId(event.threadId());
        doc.setAgentId(event.agentId());
        doc.setProvider(event.provider());
        doc.setModel(event.model());
        doc.setMessageCount(event.messageCount());
        doc.setPromptTokens(event.usage().promptTokens());
        doc.setCompletionTokens(event.usage().completionTokens());
        doc.setTokensEstimated(event.usage().estimated());
        doc.setToolCallCount(event.toolCallCount());
        doc.setDurationMs(event.durationMs());
        doc.setSuccess(event.success());
        doc.setErrorMessage(event.errorMessage());
        doc.setTimestamp(event.timestamp());
        llmInteractionRepository.save(doc);
        log.debug("Recorded {} tokens for thread {} ({}ms, success={})",
                event.usage().totalTokens(), event.threadId(), event.durationMs(), event.success());
    }
}
