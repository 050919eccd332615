package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.protocol.api.ApprovalDecision;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.ResolveApprovalRequest;
import io.github.drompincen.agentinbox.runtime.inbox.InboxService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/inbox/approvals")
public class ApprovalController {

    private final InboxService inboxService;

    public ApprovalController(InboxService inboxService) {
        this.inboxService = inboxService;
    }

    @GetMapping
    public List<ApprovalDto> pending(@RequestHeader(value = InboxController.USER_HEADER,
            defaultValue = InboxController.DEFAULT_USER) String userId) {
        return inboxService.listPendingApprovals(userId);
    }

    @PostMapping("/{approvalId}/approve")
    public ApprovalDto approve(@RequestHeader(value = InboxController.USER_HEADER,
                                       defaultValue = InboxController.DEFAULT_USER) String userId,
                               @PathVariable String approvalId,
                               @RequestBody(required = false) ResolveApprovalRequest request) {
        return inboxService.resolveApproval(approvalId, ApprovalDecision.APPROVE, userId, comment(request));
    }

    @PostMapping("/{approvalId}/reject")
    public ApprovalDto reject(@RequestHeader(value = InboxController.USER_HEADER,
                                      defaultValue = InboxController.DEFAULT_USER) String userId,
                              @PathVariable String approvalId,
                              @RequestBody(required = false) ResolveApprovalRequest request) {
        return inboxService.resolveApproval(approvalId, ApprovalDecision.REJECT, userId, comment(request));
    }

    private static String comment(ResolveApprovalRequest request) {
        return request != null ? request.comment() : null;
    }
}
