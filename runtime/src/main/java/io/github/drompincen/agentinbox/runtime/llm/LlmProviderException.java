package io.github.drompincen.agentinbox.runtime.llm;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.Locale;

/**
 * Failure reported by the generation provider. Authentication problems and client errors
 * other than rate limiting are not retryable.
 */
public class LlmProviderException extends RuntimeException {

    private final boolean retryable;

    public LlmProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LlmProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static LlmProviderException from(Throwable error) {
        Throwable t = Exceptions.unwrap(error);
        if (t instanceof LlmProviderException e) return e;

        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new LlmProviderException(message, isRetryable(t), t);
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof NonTransientAiException) return false;
        if (t instanceof WebClientResponseException w) {
            int status = w.getStatusCode().value();
            if (status == 429) return true;
            if (status >= 400 && status < 500) return false;
        }
        String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
        return !(message.contains("invalid api key")
                || message.contains("incorrect api key")
                || message.contains("authentication")
                || message.contains("unauthorized"));
    }
}
