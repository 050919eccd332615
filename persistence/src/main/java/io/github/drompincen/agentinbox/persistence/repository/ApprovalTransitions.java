package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;

import java.util.List;
import java.util.Optional;

/**
 * Compare-and-swap operations on approvals. Every method only touches a row whose status is
 * still {@link ApprovalStatus#PENDING}.
 */
public interface ApprovalTransitions {

    /**
     * Atomically resolves a pending approval.
     *
     * @return the resolved approval, or empty if it does not exist or is no longer pending
     */
    Optional<ApprovalDocument> resolveIfPending(String approvalId, ApprovalStatus status,
                                                String resolvedBy, String comment);

    /**
     * Appends actions to the queue of a pending approval.
     *
     * @return false if the approval is no longer pending
     */
    boolean enqueueIfPending(String approvalId, List<ApprovalDocument.QueuedAction> actions);
}
