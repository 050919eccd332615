package io.github.drompincen.agentinbox.runtime.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.runtime.agent.AgentRegistry;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.llm.LlmRequest;
import io.github.drompincen.agentinbox.runtime.llm.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmIntentClassifierTest {

    @Mock
    private LlmService llmService;

    private LlmIntentClassifier classifier;
    private AgentRegistry agents;

    @BeforeEach
    void setUp() {
        InboxProperties properties = new InboxProperties();
        properties.getRouter().setClassifierTimeoutMs(2_000);
        classifier = new LlmIntentClassifier(llmService, new ObjectMapper(), properties);
        agents = new AgentRegistry(properties);
    }

    @Test
    void parsesPlainJsonAnswer() {
        when(llmService.isAvailable()).thenReturn(true);
        when(llmService.call(any())).thenReturn("{\"agent\": \"Dexter\", \"confidence\": 0.8, \"reasoning\": \"numbers\"}");

        IntentClassifier.Classification result = classifier.classify("ROI?", List.of("user: hi"), agents.all());

        assertThat(result.agentId()).isEqualTo("dexter");
        assertThat(result.confidence()).isEqualTo(0.8);
        assertThat(result.reasoning()).isEqualTo("numbers");

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmService).call(request.capture());
        assertThat(request.getValue().messages().get(0).content()).contains("- dexter:");
        assertThat(request.getValue().messages().get(1).content()).contains("user: hi").endsWith("ROI?");
    }

    @Test
    void acceptsFencedJsonAndClampsConfidence() throws Exception {
        IntentClassifier.Classification result = classifier.parse(
                "Sure!\n```json\n{\"agent\": \"emmie\", \"confidence\": 3}\n```");

        assertThat(result.agentId()).isEqualTo("emmie");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void answerWithoutAgentIsAFailure() {
        assertThatThrownBy(() -> classifier.parse("{\"confidence\": 0.3}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unavailableProviderFailsFast() {
        when(llmService.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> classifier.classify("hi", List.of(), agents.all()))
                .isInstanceOf(IllegalStateException.class);
        verify(llmService, never()).call(any());
    }
}
