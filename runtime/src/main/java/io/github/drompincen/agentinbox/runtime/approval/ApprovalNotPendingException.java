package io.github.drompincen.agentinbox.runtime.approval;

public class ApprovalNotPendingException extends RuntimeException {

    private final String approvalId;

    public ApprovalNotPendingException(String approvalId) {
        super("Approval is no longer pending");
        this.approvalId = approvalId;
    }

    public String getApprovalId() {
        return approvalId;
    }
}
