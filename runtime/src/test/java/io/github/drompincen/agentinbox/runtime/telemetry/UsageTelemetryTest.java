package io.github.drompincen.agentinbox.runtime.telemetry;

import io.github.drompincen.agentinbox.persistence.document.LlmInteractionDocument;
import io.github.drompincen.agentinbox.persistence.repository.LlmInteractionRepository;
import io.github.drompincen.agentinbox.protocol.event.TokenUsage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UsageTelemetryTest {

    @Mock
    private LlmInteractionRepository repository;

    private UsageEvent event(boolean success, String error) {
        return new UsageEvent("t1", "dexter", "openai", "gpt-4o", 4, new TokenUsage(100, 25, true),
                2, 1500, success, error, Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    void eventIsStoredAsInteraction() {
        new MongoUsageTelemetry(repository).record(event(false, "503 overloaded"));

        ArgumentCaptor<LlmInteractionDocument> doc = ArgumentCaptor.forClass(LlmInteractionDocument.class);
        verify(repository).save(doc.capture());
        LlmInteractionDocument saved = doc.getValue();
        assertThat(saved.getInteractionId()).isNotBlank();
        assertThat(saved.getThreadId()).isEqualTo("t1");
        assertThat(saved.getPromptTokens()).isEqualTo(100);
        assertThat(saved.getCompletionTokens()).isEqualTo(25);
        assertThat(saved.isTokensEstimated()).isTrue();
        assertThat(saved.getToolCallCount()).isEqualTo(2);
        assertThat(saved.isSuccess()).isFalse();
        assertThat(saved.getErrorMessage()).isEqualTo("503 overloaded");
    }

    @Test
    void storeFailureNeverReachesTheTurn() {
        when(repository.save(any())).thenThrow(new IllegalStateException("mongo down"));
        UsageTelemetry telemetry = GuardedUsageTelemetry.wrap(new MongoUsageTelemetry(repository));

        assertThatCode(() -> telemetry.record(event(true, null))).doesNotThrowAnyException();
    }
}
