package io.github.drompincen.agentinbox.runtime.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;
import io.github.drompincen.agentinbox.protocol.event.OrchestrationEvent;
import io.github.drompincen.agentinbox.protocol.event.StopReason;
import io.github.drompincen.agentinbox.protocol.event.TokenUsage;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.llm.ChatTurn;
import io.github.drompincen.agentinbox.runtime.llm.LlmProviderException;
import io.github.drompincen.agentinbox.runtime.llm.LlmRequest;
import io.github.drompincen.agentinbox.runtime.llm.LlmService;
import io.github.drompincen.agentinbox.runtime.llm.ToolCallRequest;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one generation session: streams model rounds, runs the tools the model asks for and
 * feeds their output back until the model answers without tool calls.
 *
 * <p>Event order within a turn is strict. Concatenating every {@link OrchestrationEvent.TextDelta}
 * yields the text carried by the terminal event.
 */
@Component
public class StreamingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StreamingOrchestrator.class);

    static final String INVALID_ARGUMENTS = "Invalid tool arguments format";

    private final LlmService llmService;
    private final InboxProperties.Orchestrator settings;
    private final ObjectMapper objectMapper;
    private final ExecutorService toolExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tool-call");
        t.setDaemon(true);
        return t;
    });

    public StreamingOrchestrator(LlmService llmService, InboxProperties properties, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.settings = properties.getOrchestrator();
        this.objectMapper = objectMapper;
    }

    @PreDestroy
    void shutdown() {
        toolExecutor.shutdownNow();
    }

    public Flux<OrchestrationEvent> run(OrchestrationRequest request) {
        return Flux.<OrchestrationEvent>create(sink -> drive(request, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void drive(OrchestrationRequest request, FluxSink<OrchestrationEvent> sink) {
        TurnState turn = new TurnState();
        List<ChatTurn> transcript = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            transcript.add(ChatTurn.system(request.systemPrompt()));
        }
        transcript.addAll(request.history());
        transcript.add(ChatTurn.user(request.userText()));

        try {
            int failedRounds = 0;
            while (true) {
                if (sink.isCancelled()) {
                    finish(sink, turn, StopReason.CANCELLED);
                    return;
                }
                Round round = streamRound(request, transcript, sink, turn);
                if (round.toolCalls.isEmpty()) {
                    finish(sink, turn, StopReason.COMPLETED);
                    return;
                }

                transcript.add(ChatTurn.assistantToolCalls(round.text.toString(), round.toolCalls));
                boolean anySucceeded = false;
                for (ToolCallRequest call : round.toolCalls) {
                    if (sink.isCancelled()) {
                        finish(sink, turn, StopReason.CANCELLED);
                        return;
                    }
                    if (turn.toolCalls.size() >= request.maxToolCalls()) {
                        log.info("Tool call limit {} reached for thread {}", request.maxToolCalls(), request.threadId());
                        finish(sink, turn, StopReason.TOOL_LIMIT);
                        return;
                    }
                    ToolCallEvent result = invokeTool(request, call, sink);
                    turn.toolCalls.add(result);
                    anySucceeded |= result.succeeded();
                    transcript.add(ChatTurn.toolResult(call.id(), call.name(), toolOutput(result)));
                }

                failedRounds = anySucceeded ? 0 : failedRounds + 1;
                if (failedRounds >= settings.getMaxConsecutiveToolFailures()) {
                    log.warn("Stopping thread {} after {} rounds of failed tool calls", request.threadId(), failedRounds);
                    finish(sink, turn, StopReason.TOOL_FAILURES);
                    return;
                }
            }
        } catch (LlmProviderException e) {
            log.warn("Provider failure in thread {} after {} chars: {}", request.threadId(), turn.text.length(), e.getMessage());
            sink.next(new OrchestrationEvent.StreamError(e.getMessage(), e.isRetryable(), turn.text.toString(), turn.usage));
            sink.complete();
        } catch (RuntimeException e) {
            log.error("Orchestration failed for thread {}", request.threadId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            sink.next(new OrchestrationEvent.StreamError(message, false, turn.text.toString(), turn.usage));
            sink.complete();
        }
    }

    private void finish(FluxSink<OrchestrationEvent> sink, TurnState turn, StopReason reason) {
        sink.next(new OrchestrationEvent.Done(turn.text.toString(), turn.toolCalls, reason, turn.usage));
        sink.complete();
    }

    /**
     * Streams one round. A round that failed before emitting anything is retried with backoff;
     * once text has reached the subscriber the failure is final.
     */
    private Round streamRound(OrchestrationRequest request, List<ChatTurn> transcript,
                              FluxSink<OrchestrationEvent> sink, TurnState turn) {
        LlmRequest llmRequest = new LlmRequest(request.threadId(), request.agentId(), transcript, request.tools());
        for (int attempt = 0; ; attempt++) {
            Round round = new Round();
            try {
                llmService.stream(llmRequest)
                        .doOnNext(chunk -> {
                            if (!chunk.text().isEmpty()) {
                                round.emitted = true;
                                round.text.append(chunk.text());
                                turn.text.append(chunk.text());
                                sink.next(new OrchestrationEvent.TextDelta(chunk.text()));
                            }
                            round.toolCalls.addAll(chunk.toolCalls());
                            if (chunk.usage() != null) {
                                round.usage = round.usage.plus(chunk.usage());
                            }
                        })
                        .blockLast();
                if (round.usage.totalTokens() == 0) {
                    round.usage = TokenUsage.estimate(llmRequest.promptChars(), round.text.length());
                }
                turn.usage = turn.usage.plus(round.usage);
                return round;
            } catch (RuntimeException e) {
                LlmProviderException failure = LlmProviderException.from(e);
                if (round.emitted || !round.toolCalls.isEmpty()
                        || !failure.isRetryable() || attempt >= settings.getMaxRetries()) {
                    throw failure;
                }
                long backoff = Math.min(settings.getInitialBackoffMs() * (1L << attempt), settings.getMaxBackoffMs());
                log.warn("Provider error in thread {} (attempt {}/{}), retrying in {}ms: {}",
                        request.threadId(), attempt + 1, settings.getMaxRetries(), backoff, failure.getMessage());
                sleep(backoff, failure);
            }
        }
    }

    private static void sleep(long millis, LlmProviderException failure) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw failure;
        }
    }

    private ToolCallEvent invokeTool(OrchestrationRequest request, ToolCallRequest call,
                                     FluxSink<OrchestrationEvent> sink) {
        String id = "tool-" + System.currentTimeMillis() + "-" + call.name();
        String displayName = request.displayName(call.name());

        JsonNode arguments;
        try {
            arguments = parseArguments(call.arguments());
        } catch (Exception e) {
            ToolCallEvent started = ToolCallEvent.running(id, call.name(), displayName,
                    TextNode.valueOf(String.valueOf(call.arguments())));
            sink.next(new OrchestrationEvent.ToolCallStarted(started));
            ToolCallEvent failed = started.failed(INVALID_ARGUMENTS);
            sink.next(new OrchestrationEvent.ToolCallResult(failed));
            return failed;
        }

        ToolCallEvent started = ToolCallEvent.running(id, call.name(), displayName, arguments);
        sink.next(new OrchestrationEvent.ToolCallStarted(started));

        ToolResult result = executeWithTimeout(request, call.name(), arguments);
        ToolCallEvent finished = result.success()
                ? started.completed(result.output())
                : started.failed(result.error());
        sink.next(new OrchestrationEvent.ToolCallResult(finished));
        log.debug("Tool {} in thread {} finished with {}", call.name(), request.threadId(), finished.status());
        return finished;
    }

    private JsonNode parseArguments(String raw) throws Exception {
        if (raw == null || raw.isBlank()) return objectMapper.createObjectNode();
        JsonNode node = objectMapper.readTree(raw);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object");
        }
        return node;
    }

    private ToolResult executeWithTimeout(OrchestrationRequest request, String toolName, JsonNode arguments) {
        CompletableFuture<ToolResult> future = CompletableFuture.supplyAsync(
                () -> request.toolExecutor().execute(toolName, arguments), toolExecutor);
        try {
            ToolResult result = future.get(settings.getToolTimeoutMs(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result: " + toolName);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool {} timed out after {}ms in thread {}", toolName, settings.getToolTimeoutMs(), request.threadId());
            return ToolResult.failure("Tool execution timed out after " + settings.getToolTimeoutMs() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure("Error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure("Tool execution interrupted");
        }
    }

    private String toolOutput(ToolCallEvent call) {
        ObjectNode node = objectMapper.createObjectNode();
        if (call.succeeded()) {
            node.put("success", true);
            node.set("result", call.result());
        } else {
            node.put("success", false);
            node.put("error", call.error());
        }
        return node.toString();
    }

    private static final class TurnState {
        final StringBuilder text = new StringBuilder();
        final List<ToolCallEvent> toolCalls = new ArrayList<>();
        TokenUsage usage = TokenUsage.NONE;
    }

    private static final class Round {
        final StringBuilder text = new StringBuilder();
        final List<ToolCallRequest> toolCalls = new ArrayList<>();
        TokenUsage usage = TokenUsage.NONE;
        boolean emitted;
    }
}
