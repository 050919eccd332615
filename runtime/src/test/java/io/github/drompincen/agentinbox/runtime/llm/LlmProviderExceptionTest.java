package io.github.drompincen.agentinbox.runtime.llm;

import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class LlmProviderExceptionTest {

    private static WebClientResponseException http(int status, String reason) {
        return WebClientResponseException.create(status, reason, HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
    }

    @Test
    void rateLimitAndServerErrorsAreRetryable() {
        assertThat(LlmProviderException.from(http(429, "Too Many Requests")).isRetryable()).isTrue();
        assertThat(LlmProviderException.from(http(503, "Unavailable")).isRetryable()).isTrue();
        assertThat(LlmProviderException.from(new RuntimeException("Connection reset")).isRetryable()).isTrue();
    }

    @Test
    void clientAndAuthenticationErrorsAreNot() {
        assertThat(LlmProviderException.from(http(HttpStatus.UNAUTHORIZED.value(), "Unauthorized")).isRetryable()).isFalse();
        assertThat(LlmProviderException.from(http(400, "Bad Request")).isRetryable()).isFalse();
        assertThat(LlmProviderException.from(new NonTransientAiException("model not found")).isRetryable()).isFalse();
        assertThat(LlmProviderException.from(new IllegalStateException("Incorrect API key provided")).isRetryable()).isFalse();
    }

    @Test
    void existingProviderExceptionIsKept() {
        LlmProviderException original = new LlmProviderException("x", true);

        assertThat(LlmProviderException.from(original)).isSameAs(original);
    }
}
