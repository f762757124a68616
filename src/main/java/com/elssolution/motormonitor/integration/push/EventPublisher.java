package com.elssolution.motormonitor.integration.push;

/**
 * Broadcast channel to live subscribers. Fire-and-forget: implementations
 * must not throw and give no ordering guarantee between event types.
 */
public interface EventPublisher {

    void publish(MonitorEvent event, Object payload);
}
