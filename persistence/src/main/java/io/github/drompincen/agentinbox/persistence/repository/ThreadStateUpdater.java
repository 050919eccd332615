package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.protocol.api.ThreadState;

import java.time.Instant;

/**
 * Atomic thread state transitions. Both columns of the state are matched and written in a
 * single update, so two writers racing on the same thread cannot both win.
 */
public interface ThreadStateUpdater {

    /**
     * Moves the thread from {@code expected} to {@code next}.
     *
     * @return false when the stored state no longer equals {@code expected}
     */
    boolean transitionState(String threadId, ThreadState expected, ThreadState next);

    /** Reassigns the thread without touching its state. */
    void assignAgent(String threadId, String agentId, String agentName);

    /**
     * Bumps the message counters and replaces the preview. Unread is only incremented for
     * messages the user has not written.
     */
    void recordMessage(String threadId, String preview, Instant at, boolean unread);

    void setUnreadCount(String threadId, int unreadCount);
}
