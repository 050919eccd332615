package io.github.drompincen.agentinbox.runtime.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GuardedUsageTelemetry implements UsageTelemetry {

    private static final Logger log = LoggerFactory.getLogger(GuardedUsageTelemetry.class);

    private final UsageTelemetry delegate;

    public GuardedUsageTelemetry(UsageTelemetry delegate) {
        this.delegate = delegate;
    }

    public static UsageTelemetry wrap(UsageTelemetry telemetry) {
        return telemetry instanceof GuardedUsageTelemetry ? telemetry : new GuardedUsageTelemetry(telemetry);
    }

    @Override
    public void record(UsageEvent event) {
        try {
            delegate.record(event);
        } catch (Exception e) {
            log.warn("Usage telemetry failed for thread {}: {}", event.threadId(), e.getMessage());
        }
    }
}
