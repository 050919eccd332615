package io.github.drompincen.agentinbox.runtime.inbox;

public class ThreadNotFoundException extends RuntimeException {

    public ThreadNotFoundException(String threadId) {
        super("Thread not found: " + threadId);
    }
}
