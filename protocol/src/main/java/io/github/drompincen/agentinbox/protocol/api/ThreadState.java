package io.github.drompincen.agentinbox.protocol.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Orchestration-visible state of a thread. A suspended thread always carries the id of
 * the approval it is waiting on; the other states never do.
 */
public sealed interface ThreadState permits ThreadState.Active, ThreadState.Suspended, ThreadState.Archived {

    ThreadStatus status();

    default Optional<String> pendingApprovalId() {
        return Optional.empty();
    }

    default boolean acceptsTurns() {
        return status() == ThreadStatus.ACTIVE;
    }

    static ThreadState active() {
        return Active.INSTANCE;
    }

    static ThreadState suspended(String approvalId) {
        return new Suspended(approvalId);
    }

    static ThreadState archived() {
        return Archived.INSTANCE;
    }

    /**
     * Rebuilds the state from its stored columns. A dangling combination (suspended without an
     * approval id) resolves to active.
     */
    static ThreadState of(ThreadStatus status, String pendingApprovalId) {
        if (status == null) return active();
        return switch (status) {
            case SUSPENDED -> pendingApprovalId != null ? suspended(pendingApprovalId) : active();
            case ARCHIVED -> archived();
            case ACTIVE -> active();
        };
    }

    final class Active implements ThreadState {
        private static final Active INSTANCE = new Active();

        private Active() {}

        @Override
        public ThreadStatus status() { return ThreadStatus.ACTIVE; }

        @Override
        public String toString() { return "Active"; }
    }

    record Suspended(String approvalId) implements ThreadState {
        public Suspended {
            Objects.requireNonNull(approvalId, "approvalId");
        }

        @Override
        public ThreadStatus status() { return ThreadStatus.SUSPENDED; }

        @Override
        public Optional<String> pendingApprovalId() { return Optional.of(approvalId); }
    }

    final class Archived implements ThreadState {
        private static final Archived INSTANCE = new Archived();

        private Archived() {}

        @Override
        public ThreadStatus status() { return ThreadStatus.ARCHIVED; }

        @Override
        public String toString() { return "Archived"; }
    }
}
