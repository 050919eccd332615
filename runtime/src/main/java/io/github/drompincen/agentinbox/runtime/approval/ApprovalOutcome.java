package io.github.drompincen.agentinbox.runtime.approval;

import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.runtime.action.ToolAction;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;

import java.util.List;
import java.util.Optional;

/**
 * What the approval gate did with the actions of one agent message.
 *
 * @param createdApproval  the approval that suspended the thread, if this message caused it
 * @param queuedOnApproval the approval the remaining actions wait behind
 * @param queuedCount      approval-requiring actions not yet turned into approvals
 */
public record ApprovalOutcome(
        List<ToolAction> actions,
        Optional<ApprovalDocument> createdApproval,
        String queuedOnApproval,
        int queuedCount,
        List<ActionResult> immediateResults
) {
    public record ActionResult(ToolAction action, ToolResult result) {}

    public static ApprovalOutcome none() {
        return new ApprovalOutcome(List.of(), Optional.empty(), null, 0, List.of());
    }

    public boolean suspended() {
        return createdApproval.isPresent() || queuedOnApproval != null;
    }
}
