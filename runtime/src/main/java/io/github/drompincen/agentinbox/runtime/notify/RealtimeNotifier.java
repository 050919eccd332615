package io.github.drompincen.agentinbox.runtime.notify;

import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.RoutingDecision;
import io.github.drompincen.agentinbox.protocol.api.ThreadSummary;
import io.github.drompincen.agentinbox.protocol.api.ToolCallEvent;

/**
 * Pushes turn progress to whoever is watching a thread or a user's inbox. Delivery is best
 * effort and has no effect on persisted state.
 */
public interface RealtimeNotifier {

    void notifyTyping(String threadId, String agentId, boolean typing);

    /** {@code stage} is {@code thinking} or {@code generating}. */
    void notifyProcessingStage(String threadId, String stage);

    void notifyMessageCreated(String threadId, MessageDto message);

    void notifyTextDelta(String threadId, String messageId, String delta);

    void notifyMessageComplete(String threadId, MessageDto message);

    void notifyToolCall(String threadId, String messageId, ToolCallEvent toolCall);

    void notifyThreadUpdated(String threadId, ThreadSummary summary);

    void notifyRoutingChanged(String threadId, RoutingDecision decision);

    void notifyApprovalResolved(String threadId, ApprovalDto approval);

    void notifyError(String threadId, String messageId, String message);
}
