package io.github.drompincen.agentinbox.runtime.inbox;

/**
 * The thread cannot take a new user message right now: it is waiting on an approval, it is
 * archived, or a turn is still running.
 */
public class ThreadBusyException extends RuntimeException {

    public ThreadBusyException(String message) {
        super(message);
    }
}
