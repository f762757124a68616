package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.ConnectivityStatus;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.integration.push.ConnectionLost;
import com.elssolution.motormonitor.integration.push.MonitorEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Connected -> Disconnected transitions, per device.
 *
 * A device goes Disconnected when a sweep sees {@code now - lastSeen > timeout}
 * while it is marked connected, or when its read fails outright. The flip is
 * edge-triggered: fields are cleared and {@code connection_lost} goes out once,
 * repeated sweeps while already disconnected do nothing.
 * Disconnected -> Connected happens in {@link MonitorState} on every successful read.
 */
@Slf4j
@Component
public class LivenessTracker {

    private static final long MIN_TIMEOUT_SECONDS = 1;

    private final MonitorState state;
    private final Map<Device, Duration> timeouts = new EnumMap<>(Device.class);

    public LivenessTracker(MonitorState state,
                           @Value("${motor.liveness.sensorModuleTimeoutSeconds:30}") long sensorModuleTimeoutSeconds,
                           @Value("${motor.liveness.controllerTimeoutSeconds:60}") long controllerTimeoutSeconds) {
        this.state = state;
        timeouts.put(Device.SENSOR_MODULE, sanitize(Device.SENSOR_MODULE, sensorModuleTimeoutSeconds, 30));
        timeouts.put(Device.CONTROLLER, sanitize(Device.CONTROLLER, controllerTimeoutSeconds, 60));
    }

    public Duration timeoutFor(Device device) {
        return timeouts.get(device);
    }

    /** @return devices that flipped to disconnected in this sweep */
    public List<Device> sweep(Instant now) {
        List<Device> lost = new ArrayList<>(2);
        for (Device d : Device.values()) {
            Duration timeout = timeouts.get(d);
            boolean flipped = transition(d, st -> isSilent(st, now, timeout),
                    d.displayName() + " connection lost - no data for " + timeout.toSeconds() + " seconds");
            if (flipped) lost.add(d);
        }
        return lost;
    }

    /** Immediate downgrade after a failed read. Edge-triggered like the sweep. */
    public boolean markUnreachable(Device device, String reason) {
        return transition(device, ConnectivityStatus::isConnected,
                device.displayName() + " connection lost - " + reason);
    }

    static boolean isSilent(ConnectivityStatus st, Instant now, Duration timeout) {
        if (!st.isConnected()) return false;
        Duration silence = st.silenceAt(now);
        return silence != null && silence.compareTo(timeout) > 0;
    }

    private boolean transition(Device device, Predicate<ConnectivityStatus> when, String message) {
        MonitorState.Change change = state.disconnectIf(device, when);
        if (!change.changed()) return false;

        log.warn("liveness_lost device={} msg={}", device.component(), message);
        state.announce(MonitorEvent.CONNECTION_LOST,
                new ConnectionLost(device.component(), message, timeouts.get(device).toSeconds()));
        return true;
    }

    private static Duration sanitize(Device d, long seconds, long fallback) {
        if (seconds < MIN_TIMEOUT_SECONDS) {
            log.warn("{} timeout {}s is invalid. Using {}s.", d.component(), seconds, fallback);
            seconds = fallback;
        }
        return Duration.ofSeconds(seconds);
    }
}
