package io.github.drompincen.agentinbox.runtime.llm;

import reactor.core.publisher.Flux;

public interface LlmService {

    /**
     * Streams one model round. Tool calls are reported, never executed. Failures are signalled
     * as {@link LlmProviderException}.
     */
    Flux<LlmChunk> stream(LlmRequest request);

    /** Blocking completion without tools, used for classification. */
    String call(LlmRequest request);

    /**
     * Returns true if a provider key is configured.
     */
    default boolean isAvailable() { return true; }

    default String providerName() { return "unknown"; }

    default String modelName() { return "unknown"; }
}
