package io.github.drompincen.agentinbox.runtime.inbox;

import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.persistence.repository.ApprovalRepository;
import io.github.drompincen.agentinbox.persistence.repository.MessageRepository;
import io.github.drompincen.agentinbox.persistence.repository.ThreadRepository;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDecision;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.CreateThreadRequest;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.MessageType;
import io.github.drompincen.agentinbox.protocol.api.ThreadDto;
import io.github.drompincen.agentinbox.protocol.api.ThreadState;
import io.github.drompincen.agentinbox.protocol.api.ThreadStatus;
import io.github.drompincen.agentinbox.runtime.action.ToolActionExtractor;
import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;
import io.github.drompincen.agentinbox.runtime.agent.AgentRegistry;
import io.github.drompincen.agentinbox.runtime.approval.ApprovalStateMachine;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.notify.GuardedRealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.notify.RealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.turn.TurnProcessor;
import io.github.drompincen.agentinbox.runtime.turn.TurnTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Entry point for everything a user does in the inbox.
 */
@Service
public class InboxService {

    private static final Logger log = LoggerFactory.getLogger(InboxService.class);

    private static final String DEFAULT_SUBJECT = "New conversation";

    private final ThreadRepository threadRepository;
    private final MessageRepository messageRepository;
    private final ApprovalRepository approvalRepository;
    private final MessageStore messageStore;
    private final AgentRegistry agentRegistry;
    private final ApprovalStateMachine approvalStateMachine;
    private final TurnProcessor turnProcessor;
    private final ToolActionExtractor extractor;
    private final InboxMapper mapper;
    private final InboxProperties properties;
    private final RealtimeNotifier notifier;

    public InboxService(ThreadRepository threadRepository,
                        MessageRepository messageRepository,
                        ApprovalRepository approvalRepository,
                        MessageStore messageStore,
                        AgentRegistry agentRegistry,
                        ApprovalStateMachine approvalStateMachine,
                        TurnProcessor turnProcessor,
                        ToolActionExtractor extractor,
                        InboxMapper mapper,
                        InboxProperties properties,
                        RealtimeNotifier notifier) {
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.approvalRepository = approvalRepository;
        this.messageStore = messageStore;
        this.agentRegistry = agentRegistry;
        this.approvalStateMachine = approvalStateMachine;
        this.turnProcessor = turnProcessor;
        this.extractor = extractor;
        this.mapper = mapper;
        this.properties = properties;
        this.notifier = GuardedRealtimeNotifier.wrap(notifier);
    }

    public ThreadDto createThread(String userId, CreateThreadRequest request) {
        AgentCapabilities agent = request.agentId() != null
                ? agentRegistry.get(request.agentId())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + request.agentId()))
                : agentRegistry.defaultAgent();

        Instant now = Instant.now();
        ThreadDocument thread = new ThreadDocument();
        thread.setThreadId(UUID.randomUUID().toString());
        thread.setUserId(userId);
        thread.setSubject(request.subject() != null && !request.subject().isBlank() ? request.subject() : DEFAULT_SUBJECT);
        thread.setAgentId(agent.agentId());
        thread.setAgentName(agent.name());
        thread.setState(ThreadState.active());
        thread.setLastMessageAt(now);
        thread.setCreatedAt(now);
        thread.setUpdatedAt(now);
        threadRepository.save(thread);
        log.info("Created thread {} for user {} with agent {}", thread.getThreadId(), userId, agent.agentId());
        notifier.notifyThreadUpdated(thread.getThreadId(), mapper.toSummary(thread));

        if (request.initialMessage() != null && !request.initialMessage().isBlank()) {
            postUserMessage(thread.getThreadId(), userId, request.initialMessage(), MessageRole.USER);
            return getThread(thread.getThreadId());
        }
        return mapper.toDto(thread);
    }

    /**
     * Stores a message and returns once it is persisted. A user message starts an agent turn;
     * an agent message goes straight to the approval gate.
     *
     * @throws ThreadBusyException if a user message arrives while the thread cannot take a turn
     */
    public MessageDto postUserMessage(String threadId, String userId, String content, MessageRole role) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        ThreadDocument thread = findThread(threadId);
        MessageRole effectiveRole = role != null ? role : MessageRole.USER;
        return switch (effectiveRole) {
            case USER -> postUserTurn(thread, userId, content);
            case AGENT -> postAgentMessage(thread, content);
            case SYSTEM -> throw new IllegalArgumentException("System messages cannot be posted");
        };
    }

    private MessageDto postUserTurn(ThreadDocument thread, String userId, String content) {
        String threadId = thread.getThreadId();
        checkAcceptsTurns(thread.getState());
        String owner = turnProcessor.reserve(threadId)
                .orElseThrow(() -> new ThreadBusyException("A reply is still being generated for this thread"));

        MessageDocument message;
        try {
            // the previous turn may have suspended the thread between the read above and the reserve
            checkAcceptsTurns(findThread(threadId).getState());
            message = messageStore.append(threadId, MessageRole.USER, MessageType.TEXT, content, null, null);
            threadRepository.recordMessage(threadId, extractor.preview(content, properties.getTurn().getPreviewChars()),
                    message.getTimestamp(), false);
            turnProcessor.submit(new TurnTask(threadId, userId, message.getMessageId(), content, owner));
        } catch (RuntimeException e) {
            turnProcessor.release(threadId, owner);
            throw e;
        }
        MessageDto dto = mapper.toDto(message);
        notifier.notifyMessageCreated(threadId, dto);
        return dto;
    }

    private static void checkAcceptsTurns(ThreadState state) {
        if (state instanceof ThreadState.Suspended suspended) {
            throw new ThreadBusyException("Thread is waiting for approval " + suspended.approvalId());
        }
        if (!state.acceptsTurns()) {
            throw new ThreadBusyException("Thread is " + state.status().name().toLowerCase(Locale.ROOT));
        }
    }

    private MessageDto postAgentMessage(ThreadDocument thread, String content) {
        String threadId = thread.getThreadId();
        MessageDocument message = messageStore.append(threadId, MessageRole.AGENT, MessageType.TEXT, content,
                thread.getAgentId(), thread.getAgentName());
        notifier.notifyMessageCreated(threadId, mapper.toDto(message));
        approvalStateMachine.onAgentMessage(threadId, message.getMessageId(), content);
        threadRepository.recordMessage(threadId, extractor.preview(content, properties.getTurn().getPreviewChars()),
                message.getTimestamp(), true);
        threadRepository.findById(threadId)
                .ifPresent(t -> notifier.notifyThreadUpdated(threadId, mapper.toSummary(t)));
        return messageRepository.findById(message.getMessageId()).map(mapper::toDto).orElseGet(() -> mapper.toDto(message));
    }

    public ApprovalDto resolveApproval(String approvalId, ApprovalDecision decision, String resolverId, String comment) {
        return mapper.toDto(approvalStateMachine.resolve(approvalId, decision, resolverId, comment).approval());
    }

    public List<ThreadDto> listThreads(String userId, boolean includeArchived) {
        List<ThreadDocument> threads = includeArchived
                ? threadRepository.findByUserIdOrderByLastMessageAtDesc(userId)
                : threadRepository.findByUserIdAndStatusNotOrderByLastMessageAtDesc(userId, ThreadStatus.ARCHIVED);
        return threads.stream().map(mapper::toDto).toList();
    }

    public ThreadDto getThread(String threadId) {
        return mapper.toDto(findThread(threadId));
    }

    public List<MessageDto> listMessages(String threadId) {
        findThread(threadId);
        return messageRepository.findByThreadIdOrderBySeqAsc(threadId).stream().map(mapper::toDto).toList();
    }

    public ThreadDto markRead(String threadId) {
        findThread(threadId);
        threadRepository.setUnreadCount(threadId, 0);
        return publish(threadId);
    }

    public ThreadDto markUnread(String threadId) {
        ThreadDocument thread = findThread(threadId);
        threadRepository.setUnreadCount(threadId, Math.max(1, thread.getUnreadCount()));
        return publish(threadId);
    }

    /**
     * Archives or reactivates a thread. Suspension is owned by the approval gate and cannot be
     * set or cleared here.
     */
    public ThreadDto updateStatus(String threadId, ThreadStatus status) {
        ThreadDocument thread = findThread(threadId);
        ThreadState current = thread.getState();
        ThreadState next = switch (status) {
            case ARCHIVED -> ThreadState.archived();
            case ACTIVE -> {
                if (current instanceof ThreadState.Suspended) {
                    throw new IllegalArgumentException("Thread is waiting for approval; resolve it instead");
                }
                yield ThreadState.active();
            }
            case SUSPENDED -> throw new IllegalArgumentException("Threads are suspended only by approvals");
        };
        if (current.equals(next)) {
            return mapper.toDto(thread);
        }
        if (!threadRepository.transitionState(threadId, current, next)) {
            throw new ThreadBusyException("Thread " + threadId + " changed concurrently, retry");
        }
        log.info("Thread {} moved from {} to {}", threadId, current, next);
        return publish(threadId);
    }

    public void deleteThread(String threadId, boolean permanent) {
        findThread(threadId);
        if (!permanent) {
            updateStatus(threadId, ThreadStatus.ARCHIVED);
            return;
        }
        messageRepository.deleteByThreadId(threadId);
        approvalRepository.deleteByThreadId(threadId);
        threadRepository.deleteById(threadId);
        log.info("Permanently deleted thread {}", threadId);
    }

    public List<ApprovalDto> listPendingApprovals(String userId) {
        return approvalStateMachine.pendingForUser(userId).stream().map(mapper::toDto).toList();
    }

    public List<AgentCapabilities> listAgents() {
        return List.copyOf(agentRegistry.all());
    }

    private ThreadDocument findThread(String threadId) {
        return threadRepository.findById(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    private ThreadDto publish(String threadId) {
        ThreadDocument thread = findThread(threadId);
        notifier.notifyThreadUpdated(threadId, mapper.toSummary(thread));
        return mapper.toDto(thread);
    }
}
