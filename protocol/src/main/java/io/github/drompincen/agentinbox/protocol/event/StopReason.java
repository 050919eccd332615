package io.github.drompincen.agentinbox.protocol.event;

public enum StopReason {
    /** The model finished without requesting further tools. */
    COMPLETED,
    /** The per-agent tool call budget was exhausted. */
    TOOL_LIMIT,
    /** Too many consecutive rounds in which every tool call failed. */
    TOOL_FAILURES,
    /** The subscriber went away between rounds. */
    CANCELLED
}
