package io.github.drompincen.agentinbox.protocol.api;

public enum ApprovalDecision {
    APPROVE(ApprovalStatus.APPROVED),
    REJECT(ApprovalStatus.REJECTED);

    private final ApprovalStatus resultingStatus;

    ApprovalDecision(ApprovalStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ApprovalStatus resultingStatus() {
        return resultingStatus;
    }
}
