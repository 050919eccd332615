package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.protocol.api.ApprovalDecision;
import io.github.drompincen.agentinbox.protocol.api.ApprovalDto;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import io.github.drompincen.agentinbox.protocol.api.ResolveApprovalRequest;
import io.github.drompincen.agentinbox.runtime.inbox.InboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalControllerTest {

    @Mock private InboxService inboxService;

    private ApprovalController controller;

    @BeforeEach
    void setUp() {
        controller = new ApprovalController(inboxService);
    }

    private static ApprovalDto approval(ApprovalStatus status) {
        return new ApprovalDto("ap-1", "t1", "m1", "gmail-send-email", Map.of("to", "a@b.com"),
                "Send email to a@b.com", status, "u1", null, null, 0, null);
    }

    @Test
    void approvePassesResolverAndComment() {
        when(inboxService.resolveApproval("ap-1", ApprovalDecision.APPROVE, "u1", "go"))
                .thenReturn(approval(ApprovalStatus.APPROVED));

        ApprovalDto result = controller.approve("u1", "ap-1", new ResolveApprovalRequest("go"));

        assertThat(result.status()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void rejectWorksWithoutBody() {
        when(inboxService.resolveApproval("ap-1", ApprovalDecision.REJECT, "u1", null))
                .thenReturn(approval(ApprovalStatus.REJECTED));

        assertThat(controller.reject("u1", "ap-1", null).status()).isEqualTo(ApprovalStatus.REJECTED);
    }

    @Test
    void pendingIsScopedToUser() {
        when(inboxService.listPendingApprovals("u1")).thenReturn(List.of(approval(ApprovalStatus.PENDING)));

        assertThat(controller.pending("u1")).extracting(ApprovalDto::approvalId).containsExactly("ap-1");
    }
}
