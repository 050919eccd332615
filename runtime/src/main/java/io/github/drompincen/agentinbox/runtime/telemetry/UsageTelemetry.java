package io.github.drompincen.agentinbox.runtime.telemetry;

/** Fire-and-forget sink for usage events. */
public interface UsageTelemetry {

    void record(UsageEvent event);
}
