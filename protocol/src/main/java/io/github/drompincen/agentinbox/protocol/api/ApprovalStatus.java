package io.github.drompincen.agentinbox.protocol.api;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
