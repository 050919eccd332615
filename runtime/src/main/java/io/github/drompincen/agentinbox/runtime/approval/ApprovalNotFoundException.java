package io.github.drompincen.agentinbox.runtime.approval;

public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String approvalId) {
        super("Approval not found: " + approvalId);
    }
}
