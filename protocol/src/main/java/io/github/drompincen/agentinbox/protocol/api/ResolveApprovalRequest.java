package io.github.drompincen.agentinbox.protocol.api;

public record ResolveApprovalRequest(String comment) {}
