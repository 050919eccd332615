package io.github.drompincen.agentinbox.runtime.notify;

import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.RoutingDecision;
import io.github.drompincen.agentinbox.protocol.api.ThreadSummary;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a notifier so that a failing observer never reaches the caller.
 */
public class GuardedRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(GuardedRealtimeNotifier.class);

    private final RealtimeNotifier delegate;

    public GuardedRealtimeNotifier(RealtimeNotifier delegate) {
        this.delegate = delegate;
    }

    public static RealtimeNotifier wrap(RealtimeNotifier notifier) {
        return notifier instanceof GuardedRealtimeNotifier ? notifier : new GuardedRealtimeNotifier(notifier);
    }

    private void guard(String event, String threadId, Runnable call) {
        try {
            call.run();
        } catch (Exception e) {
            log.warn("Notifier failed on {} for thread {}: {}", event, threadId, e.getMessage());
        }
    }

    @Override
    public void notifyTyping(String threadId, String agentId, boolean typing) {
        guard("typing", threadId, () -> delegate.notifyTyping(threadId, agentId, typing));
    }

    @Override
    public void notifyProcessingStage(String threadId, String stage) {
        guard("processing stage", threadId, () -> delegate.notifyProcessingStage(threadId, stage));
    }

    @Override
    public void notifyMessageCreated(String threadId, MessageDto message) {
        guard("message created", threadId, () -> delegate.notifyMessageCreated(threadId, message));
    }

    @Override
    public void notifyTextDelta(String threadId, String messageId, String delta) {
        guard("text delta", threadId, () -> delegate.notifyTextDelta(threadId, messageId, delta));
    }

    @Override
    public void notifyMessageComplete(String threadId, MessageDto message) {
        guard("message complete", threadId, () -> delegate.notifyMessageComplete(threadId, message));
    }

    @Override
    public void notifyToolCall(String threadId, String messageId, ToolCallEvent toolCall) {
        guard("tool call", threadId, () -> delegate.notifyToolCall(threadId, messageId, toolCall));
    }

    @Override
    public void notifyThreadUpdated(String threadId, ThreadSummary summary) {
        guard("thread updated", threadId, () -> delegate.notifyThreadUpdated(threadId, summary));
    }

    @Override
    public void notifyRoutingChanged(String threadId, RoutingDecision decision) {
        guard("routing changed", threadId, () -> delegate.notifyRoutingChanged(threadId, decision));
    }

    @Override
    public void notifyApprovalResolved(String threadId, ApprovalDto approval) {
        guard("approval resolved", threadId, () -> delegate.notifyApprovalResolved(threadId, approval));
    }

    @Override
    public void notifyError(String threadId, String messageId, String message) {
        guard("error", threadId, () -> delegate.notifyError(threadId, messageId, message));
    }
}
