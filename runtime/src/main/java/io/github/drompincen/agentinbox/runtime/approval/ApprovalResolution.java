package io.github.drompincen.agentinbox.runtime.approval;

import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.protocol.api.ThreadState;

import java.util.Optional;

/**
 * @param promoted   next queued action, now the pending approval the thread waits on
 * @param threadState the thread's state after the resolution
 */
public record ApprovalResolution(
        ApprovalDocument approval,
        Optional<ApprovalDocument> promoted,
        ThreadState threadState
) {}
