package io.github.drompincen.agentinbox.runtime.turn;

/**
 * A stored user message waiting for an agent reply. {@code lockOwner} is the token returned by
 * {@link TurnProcessor#reserve(String)}.
 */
public record TurnTask(
        String threadId,
        String userId,
        String userMessageId,
        String content,
        String lockOwner
) {}
