package io.github.drompincen.agentinbox.runtime.turn;

import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.persistence.repository.MessageRepository;
import io.github.drompincen.agentinbox.persistence.repository.ThreadRepository;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.MessageType;
import io.github.drompincen.agentinbox.protocol.api.RoutingDecision;
import io.github.drompincen.agentinbox.protocol.api.ThreadState;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;
import io.github.drompincen.agentinbox.protocol.event.OrchestrationEvent;
import io.github.drompincen.agentinbox.protocol.event.TokenUsage;
import io.github.drompincen.agentinbox.runtime.action.ToolActionExtractor;
import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;
import io.github.drompincen.agentinbox.runtime.agent.AgentRegistry;
import io.github.drompincen.agentinbox.runtime.approval.ApprovalStateMachine;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.inbox.InboxMapper;
import io.github.drompincen.agentinbox.runtime.inbox.MessageStore;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadNotFoundException;
import io.github.drompincen.agentinbox.runtime.llm.ChatTurn;
import io.github.drompincen.agentinbox.runtime.llm.LlmService;
import io.github.drompincen.agentinbox.runtime.llm.ToolSpec;
import io.github.drompincen.agentinbox.runtime.notify.GuardedRealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.notify.RealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.orchestration.OrchestrationRequest;
import io.github.drompincen.agentinbox.runtime.orchestration.StreamingOrchestrator;
import io.github.drompincen.agentinbox.runtime.routing.ContextLine;
import io.github.drompincen.agentinbox.runtime.routing.IntentRouter;
import io.github.drompincen.agentinbox.runtime.telemetry.GuardedUsageTelemetry;
import io.github.drompincen.agentinbox.runtime.telemetry.UsageEvent;
import io.github.drompincen.agentinbox.runtime.telemetry.UsageTelemetry;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs agent turns on a dedicated worker pool, one at a time per thread.
 *
 * <p>A turn routes the message, streams the reply into a pre-created agent message, stores it,
 * reports usage and hands the final text to the approval gate. Each turn has its own error
 * boundary; a failure is logged, surfaced to observers and never leaves the thread locked.
 */
@Service
public class TurnProcessor {

    private static final Logger log = LoggerFactory.getLogger(TurnProcessor.class);

    static final String STAGE_THINKING = "thinking";
    static final String STAGE_GENERATING = "generating";

    private final ThreadRepository threadRepository;
    private final MessageRepository messageRepository;
    private final MessageStore messageStore;
    private final AgentRegistry agentRegistry;
    private final ToolRegistry toolRegistry;
    private final IntentRouter intentRouter;
    private final StreamingOrchestrator orchestrator;
    private final ApprovalStateMachine approvalStateMachine;
    private final ToolActionExtractor extractor;
    private final InboxMapper mapper;
    private final LlmService llmService;
    private final TurnLockService lockService;
    private final InboxProperties properties;
    private final RealtimeNotifier notifier;
    private final UsageTelemetry telemetry;

    private final ExecutorService executor;
    private final ConcurrentHashMap<String, String> runningTurns = new ConcurrentHashMap<>();

    public TurnProcessor(ThreadRepository threadRepository,
                         MessageRepository messageRepository,
                         MessageStore messageStore,
                         AgentRegistry agentRegistry,
                         ToolRegistry toolRegistry,
                         IntentRouter intentRouter,
                         StreamingOrchestrator orchestrator,
                         ApprovalStateMachine approvalStateMachine,
                         ToolActionExtractor extractor,
                         InboxMapper mapper,
                         LlmService llmService,
                         TurnLockService lockService,
                         InboxProperties properties,
                         RealtimeNotifier notifier,
                         UsageTelemetry telemetry) {
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.messageStore = messageStore;
        this.agentRegistry = agentRegistry;
        this.toolRegistry = toolRegistry;
        this.intentRouter = intentRouter;
        this.orchestrator = orchestrator;
        this.approvalStateMachine = approvalStateMachine;
        this.extractor = extractor;
        this.mapper = mapper;
        this.llmService = llmService;
        this.lockService = lockService;
        this.properties = properties;
        this.notifier = GuardedRealtimeNotifier.wrap(notifier);
        this.telemetry = GuardedUsageTelemetry.wrap(telemetry);
        this.executor = Executors.newFixedThreadPool(properties.getTurn().getPoolSize(), r -> {
            Thread t = new Thread(r, "turn-worker");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Claims the thread for one turn, in process and in the store.
     *
     * @return the lock owner token, or empty if a turn is already running
     */
    public Optional<String> reserve(String threadId) {
        if (runningTurns.containsKey(threadId)) {
            return Optional.empty();
        }
        Optional<String> owner = lockService.tryAcquire(threadId);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        if (runningTurns.putIfAbsent(threadId, owner.get()) != null) {
            lockService.release(threadId, owner.get());
            return Optional.empty();
        }
        return owner;
    }

    public void release(String threadId, String owner) {
        runningTurns.remove(threadId, owner);
        lockService.release(threadId, owner);
    }

    public boolean isRunning(String threadId) {
        return runningTurns.containsKey(threadId) || lockService.isLocked(threadId);
    }

    public void submit(TurnTask task) {
        try {
            executor.execute(() -> process(task));
        } catch (RejectedExecutionException e) {
            release(task.threadId(), task.lockOwner());
            throw e;
        }
    }

    void process(TurnTask task) {
        String threadId = task.threadId();
        try {
            runTurn(task);
        } catch (Exception e) {
            log.error("Turn failed for thread {}", threadId, e);
            notifier.notifyError(threadId, null, e.getMessage() != null ? e.getMessage() : "Unknown error");
        } finally {
            notifier.notifyTyping(threadId, null, false);
            release(threadId, task.lockOwner());
        }
    }

    void runTurn(TurnTask task) {
        String threadId = task.threadId();
        long startedAt = System.currentTimeMillis();
        ThreadDocument thread = threadRepository.findById(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
        ThreadState state = thread.getState();
        if (!state.acceptsTurns()) {
            log.info("Skipping turn for thread {}: thread is {}", threadId, state.status().name().toLowerCase(Locale.ROOT));
            return;
        }

        List<MessageDocument> prior = priorMessages(threadId, task.userMessageId());

        RoutingDecision decision = intentRouter.route(task.content(), thread.getAgentId(), contextLines(prior));
        AgentCapabilities agent = agentRegistry.getOrDefault(decision.agentId());
        if (!agent.agentId().equals(thread.getAgentId())) {
            threadRepository.assignAgent(threadId, agent.agentId(), agent.name());
            notifier.notifyRoutingChanged(threadId, decision);
            log.info("Thread {} routed from {} to {} ({})", threadId, thread.getAgentId(), agent.agentId(), decision.reasoning());
        }

        notifier.notifyTyping(threadId, agent.agentId(), true);
        notifier.notifyProcessingStage(threadId, STAGE_THINKING);

        MessageDocument reply = messageStore.append(threadId, MessageRole.AGENT, MessageType.TEXT, "",
                agent.agentId(), agent.name());
        String messageId = reply.getMessageId();
        notifier.notifyMessageCreated(threadId, mapper.toDto(reply));

        List<ChatTurn> history = history(prior);
        OrchestrationRequest request = new OrchestrationRequest(threadId, agent.agentId(), agent.systemPrompt(),
                history, decision.effectiveText(),
                agent.tools(toolRegistry).stream().map(ToolSpec::of).toList(),
                agent.executor(toolRegistry, new ToolContext(threadId, task.userId(), agent.agentId())),
                agent.maxToolCalls());

        AtomicBoolean generating = new AtomicBoolean();
        Map<String, ToolCallEvent> toolCalls = Collections.synchronizedMap(new LinkedHashMap<>());
        OrchestrationEvent terminal = orchestrator.run(request)
                .doOnNext(event -> {
                    if (event instanceof OrchestrationEvent.TextDelta delta) {
                        if (generating.compareAndSet(false, true)) {
                            notifier.notifyProcessingStage(threadId, STAGE_GENERATING);
                        }
                        notifier.notifyTextDelta(threadId, messageId, delta.text());
                    } else if (event instanceof OrchestrationEvent.ToolCallStarted started) {
                        toolCalls.put(started.call().id(), started.call());
                        notifier.notifyToolCall(threadId, messageId, started.call());
                    } else if (event instanceof OrchestrationEvent.ToolCallResult result) {
                        toolCalls.put(result.call().id(), result.call());
                        notifier.notifyToolCall(threadId, messageId, result.call());
                    }
                })
                .filter(OrchestrationEvent::isTerminal)
                .blockLast();

        String text;
        TokenUsage usage;
        String error = null;
        if (terminal instanceof OrchestrationEvent.Done done) {
            text = done.text();
            usage = done.usage();
            log.debug("Turn for thread {} finished: {}", threadId, done.stopReason());
        } else if (terminal instanceof OrchestrationEvent.StreamError streamError) {
            text = streamError.text();
            usage = streamError.usage();
            error = streamError.message();
        } else {
            text = "";
            usage = TokenUsage.NONE;
            error = "Generation ended without a result";
        }

        reply.setContent(text);
        reply.setToolCalls(toolCalls.values().stream().map(mapper::toRecord).toList());
        TurnPersistenceException persistFailure = null;
        try {
            reply = messageRepository.save(reply);
        } catch (RuntimeException e) {
            log.error("Failed to store agent message {} for thread {} ({} chars)", messageId, threadId, text.length());
            persistFailure = new TurnPersistenceException("Failed to store agent message " + messageId, e);
        }

        boolean success = error == null && persistFailure == null;
        telemetry.record(new UsageEvent(threadId, agent.agentId(), llmService.providerName(), llmService.modelName(),
                history.size() + 2, usage, toolCalls.size(), System.currentTimeMillis() - startedAt,
                success, error != null ? error : persistFailure != null ? persistFailure.getMessage() : null,
                Instant.now()));
        if (persistFailure != null) {
            throw persistFailure;
        }

        notifier.notifyMessageComplete(threadId, mapper.toDto(reply));
        if (error != null) {
            notifier.notifyError(threadId, messageId, error);
        } else {
            approvalStateMachine.onAgentMessage(threadId, messageId, text);
        }

        threadRepository.recordMessage(threadId,
                extractor.preview(text, properties.getTurn().getPreviewChars()), Instant.now(), true);
        threadRepository.findById(threadId)
                .ifPresent(t -> notifier.notifyThreadUpdated(threadId, mapper.toSummary(t)));
    }

    private List<MessageDocument> priorMessages(String threadId, String currentMessageId) {
        int window = Math.max(properties.getOrchestrator().getHistoryMessages(), properties.getRouter().getContextMessages());
        List<MessageDocument> recent = new ArrayList<>(
                messageRepository.findByThreadIdOrderBySeqDesc(threadId, PageRequest.of(0, window + 1)));
        recent.removeIf(m -> m.getMessageId().equals(currentMessageId)
                || m.getRole() == MessageRole.SYSTEM
                || m.getContent() == null || m.getContent().isBlank());
        if (recent.size() > window) {
            recent = new ArrayList<>(recent.subList(0, window));
        }
        Collections.reverse(recent);
        return recent;
    }

    private List<ContextLine> contextLines(List<MessageDocument> prior) {
        return prior.stream()
                .map(m -> new ContextLine(m.getRole() == MessageRole.USER ? "user" : "assistant",
                        extractor.strip(m.getContent())))
                .toList();
    }

    private List<ChatTurn> history(List<MessageDocument> prior) {
        int limit = properties.getOrchestrator().getHistoryMessages();
        List<MessageDocument> window = prior.size() > limit ? prior.subList(prior.size() - limit, prior.size()) : prior;
        return window.stream()
                .map(m -> m.getRole() == MessageRole.USER
                        ? ChatTurn.user(m.getContent())
                        : ChatTurn.assistant(extractor.strip(m.getContent())))
                .toList();
    }
}
