package io.github.drompincen.agentinbox.runtime.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.persistence.repository.ApprovalRepository;
import io.github.drompincen.agentinbox.persistence.repository.MessageRepository;
import io.github.drompincen.agentinbox.persistence.repository.ThreadRepository;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDecision;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.MessageType;
import io.github.drompincen.agentinbox.protocol.api.ThreadState;
import io.github.drompincen.agentinbox.runtime.action.ToolAction;
import io.github.drompincen.agentinbox.runtime.action.ToolActionExtractor;
import io.github.drompincen.agentinbox.runtime.inbox.InboxMapper;
import io.github.drompincen.agentinbox.runtime.inbox.MessageStore;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadNotFoundException;
import io.github.drompincen.agentinbox.runtime.notify.GuardedRealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.notify.RealtimeNotifier;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolRegistry;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Gates side-effecting actions behind human sign-off.
 *
 * <p>A thread has at most one pending approval. While it waits the thread is suspended on that
 * approval's id; further approval-requiring actions queue behind it and are promoted one at a
 * time as each approval is resolved. Status only moves from PENDING to APPROVED or REJECTED,
 * enforced by a compare-and-swap in the store.
 */
@Service
public class ApprovalStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ApprovalStateMachine.class);

    private static final int MAX_STATE_ATTEMPTS = 3;

    private final ApprovalRepository approvalRepository;
    private final ThreadRepository threadRepository;
    private final MessageRepository messageRepository;
    private final MessageStore messageStore;
    private final ToolActionExtractor extractor;
    private final ToolRegistry toolRegistry;
    private final InboxMapper mapper;
    private final ObjectMapper objectMapper;
    private final RealtimeNotifier notifier;

    public ApprovalStateMachine(ApprovalRepository approvalRepository,
                                ThreadRepository threadRepository,
                                MessageRepository messageRepository,
                                MessageStore messageStore,
                                ToolActionExtractor extractor,
                                ToolRegistry toolRegistry,
                                InboxMapper mapper,
                                ObjectMapper objectMapper,
                                RealtimeNotifier notifier) {
        this.approvalRepository = approvalRepository;
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.messageStore = messageStore;
        this.extractor = extractor;
        this.toolRegistry = toolRegistry;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.notifier = GuardedRealtimeNotifier.wrap(notifier);
    }

    /**
     * Handles the actions found in a stored agent message. Actions that need no approval run now;
     * the first approval-requiring one suspends the thread and the rest queue behind it.
     */
    public ApprovalOutcome onAgentMessage(String threadId, String messageId, String finalText) {
        List<ToolAction> actions = extractor.extract(finalText);
        if (actions.isEmpty()) {
            return ApprovalOutcome.none();
        }
        ThreadDocument thread = threadRepository.findById(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
        ToolContext ctx = new ToolContext(threadId, thread.getUserId(), thread.getAgentId());

        List<ApprovalOutcome.ActionResult> immediate = new ArrayList<>();
        List<ToolAction> gated = new ArrayList<>();
        for (ToolAction action : actions) {
            if (action.requiresApproval()) {
                gated.add(action);
            } else {
                ToolResult result = toolRegistry.execute(action.wireType(), ctx, objectMapper.valueToTree(action.params()));
                log.info("Executed {} for thread {}: success={}", action.wireType(), threadId, result.success());
                immediate.add(new ApprovalOutcome.ActionResult(action, result));
            }
        }
        if (!immediate.isEmpty()) {
            recordImmediateResults(thread, immediate);
        }
        if (gated.isEmpty()) {
            return new ApprovalOutcome(actions, Optional.empty(), null, 0, immediate);
        }

        for (int attempt = 0; attempt < MAX_STATE_ATTEMPTS; attempt++) {
            ThreadDocument current = attempt == 0 ? thread : threadRepository.findById(threadId)
                    .orElseThrow(() -> new ThreadNotFoundException(threadId));
            ThreadState state = current.getState();

            if (state instanceof ThreadState.Suspended suspended) {
                if (approvalRepository.enqueueIfPending(suspended.approvalId(), toQueued(gated, messageId))) {
                    log.info("Queued {} actions behind approval {} in thread {}", gated.size(), suspended.approvalId(), threadId);
                    markMessage(messageId, suspended.approvalId(), false);
                    return new ApprovalOutcome(actions, Optional.empty(), suspended.approvalId(), gated.size(), immediate);
                }
                continue;
            }
            if (state instanceof ThreadState.Archived) {
                log.warn("Dropping {} approval-requiring actions for archived thread {}", gated.size(), threadId);
                return new ApprovalOutcome(actions, Optional.empty(), null, 0, immediate);
            }

            ApprovalDocument approval = newApproval(current, messageId, gated.get(0),
                    toQueued(gated.subList(1, gated.size()), messageId));
            approvalRepository.save(approval);
            if (threadRepository.transitionState(threadId, state, ThreadState.suspended(approval.getApprovalId()))) {
                log.info("Thread {} suspended on approval {} ({})", threadId, approval.getApprovalId(), approval.getPreview());
                markMessage(messageId, approval.getApprovalId(), true);
                publishThread(threadId);
                return new ApprovalOutcome(actions, Optional.of(approval), approval.getApprovalId(),
                        gated.size() - 1, immediate);
            }
            approvalRepository.deleteById(approval.getApprovalId());
        }
        throw new IllegalStateException("Thread " + threadId + " changed state concurrently, approval not recorded");
    }

    /**
     * Resolves a pending approval. Nothing is written unless the approval was still pending.
     */
    public ApprovalResolution resolve(String approvalId, ApprovalDecision decision, String resolverId, String comment) {
        if (!approvalRepository.existsById(approvalId)) {
            throw new ApprovalNotFoundException(approvalId);
        }
        ApprovalDocument approval = approvalRepository
                .resolveIfPending(approvalId, decision.resultingStatus(), resolverId, comment)
                .orElseThrow(() -> new ApprovalNotPendingException(approvalId));
        String threadId = approval.getThreadId();
        log.info("Approval {} {} by {} in thread {}", approvalId, approval.getStatus(), resolverId, threadId);

        updateMessageSnapshot(approval.getMessageId(), approvalId, approval.getStatus());

        Optional<ApprovalDocument> promoted = Optional.empty();
        ThreadState next = ThreadState.active();
        List<ApprovalDocument.QueuedAction> queue = approval.getQueuedActions();
        if (queue != null && !queue.isEmpty()) {
            ApprovalDocument nextApproval = promote(approval, queue);
            approvalRepository.save(nextApproval);
            promoted = Optional.of(nextApproval);
            next = ThreadState.suspended(nextApproval.getApprovalId());
        }

        if (!threadRepository.transitionState(threadId, ThreadState.suspended(approvalId), next)) {
            log.warn("Thread {} was not suspended on approval {}, leaving its state unchanged", threadId, approvalId);
            if (promoted.isPresent()) {
                approvalRepository.deleteById(promoted.get().getApprovalId());
                log.warn("Dropped {} queued actions of approval {}", queue.size(), approvalId);
                promoted = Optional.empty();
            }
            next = threadRepository.findById(threadId).map(ThreadDocument::getState).orElse(ThreadState.active());
        } else if (promoted.isPresent()) {
            ApprovalDocument p = promoted.get();
            log.info("Thread {} now waiting on queued approval {} ({})", threadId, p.getApprovalId(), p.getPreview());
            updateMessageSnapshot(p.getMessageId(), p.getApprovalId(), ApprovalStatus.PENDING);
        }

        notifier.notifyApprovalResolved(threadId, mapper.toDto(approval));
        publishThread(threadId);
        return new ApprovalResolution(approval, promoted, next);
    }

    public List<ApprovalDocument> pendingForUser(String userId) {
        return approvalRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, ApprovalStatus.PENDING);
    }

    private ApprovalDocument newApproval(ThreadDocument thread, String messageId, ToolAction action,
                                         List<ApprovalDocument.QueuedAction> queued) {
        ApprovalDocument doc = new ApprovalDocument();
        doc.setApprovalId(UUID.randomUUID().toString());
        doc.setThreadId(thread.getThreadId());
        doc.setMessageId(messageId);
        doc.setUserId(thread.getUserId());
        doc.setActionType(action.wireType());
        doc.setParams(action.params());
        doc.setPreview(action.preview());
        doc.setStatus(ApprovalStatus.PENDING);
        doc.setQueuedActions(new ArrayList<>(queued));
        doc.setCreatedAt(Instant.now());
        return doc;
    }

    private ApprovalDocument promote(ApprovalDocument resolved, List<ApprovalDocument.QueuedAction> queue) {
        ApprovalDocument.QueuedAction head = queue.get(0);
        ApprovalDocument doc = new ApprovalDocument();
        doc.setApprovalId(UUID.randomUUID().toString());
        doc.setThreadId(resolved.getThreadId());
        doc.setMessageId(head.getMessageId());
        doc.setUserId(resolved.getUserId());
        doc.setActionType(head.getActionType());
        doc.setParams(head.getParams());
        doc.setPreview(head.getPreview());
        doc.setStatus(ApprovalStatus.PENDING);
        doc.setQueuedActions(new ArrayList<>(queue.subList(1, queue.size())));
        doc.setCreatedAt(Instant.now());
        return doc;
    }

    private List<ApprovalDocument.QueuedAction> toQueued(List<ToolAction> actions, String messageId) {
        return actions.stream()
                .map(a -> new ApprovalDocument.QueuedAction(a.wireType(), a.params(), a.preview(), messageId))
                .toList();
    }

    private void markMessage(String messageId, String approvalId, boolean raisedApproval) {
        messageRepository.findById(messageId).ifPresent(msg -> {
            msg.setApprovalId(approvalId);
            msg.setApprovalStatus(ApprovalStatus.PENDING);
            if (raisedApproval) {
                msg.setType(MessageType.APPROVAL_REQUEST);
            }
            messageRepository.save(msg);
        });
    }

    private void updateMessageSnapshot(String messageId, String approvalId, ApprovalStatus status) {
        if (messageId == null) return;
        messageRepository.findById(messageId).ifPresent(msg -> {
            msg.setApprovalId(approvalId);
            msg.setApprovalStatus(status);
            messageRepository.save(msg);
        });
    }

    private void recordImmediateResults(ThreadDocument thread, List<ApprovalOutcome.ActionResult> results) {
        StringBuilder sb = new StringBuilder();
        for (ApprovalOutcome.ActionResult r : results) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(r.result().success() ? "Completed: " : "Failed: ").append(r.action().preview());
            if (!r.result().success()) {
                sb.append(" (").append(r.result().error()).append(')');
            } else if (r.result().summary() != null) {
                sb.append(" (").append(r.result().summary()).append(')');
            }
        }
        MessageDocument event = messageStore.append(thread.getThreadId(), MessageRole.SYSTEM,
                MessageType.SYSTEM_EVENT, sb.toString(), null, null);
        notifier.notifyMessageCreated(thread.getThreadId(), mapper.toDto(event));
    }

    private void publishThread(String threadId) {
        threadRepository.findById(threadId)
                .ifPresent(t -> notifier.notifyThreadUpdated(threadId, mapper.toSummary(t)));
    }
}
